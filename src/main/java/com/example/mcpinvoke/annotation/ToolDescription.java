package com.example.mcpinvoke.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Human-readable description surfaced in {@code tools/list}.
 *
 * <p>On a handler method it describes the tool; on a method parameter, field or record component
 * it describes the corresponding schema entry.
 *
 * <pre>{@code
 * @ToolDescription("Adds two integers")
 * @PostMapping("/add")
 * public int add(@ToolDescription("First operand") @RequestParam int a,
 *                @RequestParam int b) { ... }
 * }</pre>
 */
@Target({ElementType.METHOD, ElementType.PARAMETER, ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ToolDescription {

    String value();
}
