package com.example.mcpinvoke.sample;

import com.example.mcpinvoke.annotation.ToolDescription;
import jakarta.validation.constraints.NotBlank;

public record Attendee(
        @NotBlank String name,
        @ToolDescription("Email address used for invitations") String email
) {
}
