package com.example.mcpinvoke.sample;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/calc")
public class CalcController {

    @GetMapping("/add")
    public int add(@RequestParam int a, @RequestParam int b) {
        return a + b;
    }

    @GetMapping("/divide")
    public ResponseEntity<Object> divide(@RequestParam double dividend, @RequestParam double divisor) {
        if (divisor == 0) {
            return ResponseEntity.badRequest().body(Map.of("message", "Division by zero"));
        }
        return ResponseEntity.ok(dividend / divisor);
    }

    @PostMapping("/sum")
    public CompletableFuture<Long> sum(@RequestBody List<Long> values) {
        return CompletableFuture.supplyAsync(() -> values.stream().mapToLong(Long::longValue).sum());
    }

    @GetMapping("/round")
    public BigDecimal round(@RequestParam BigDecimal value,
                            @RequestParam(defaultValue = "2") int scale,
                            @RequestParam(defaultValue = "HALF_UP") RoundingMode mode) {
        return value.setScale(scale, mode);
    }
}
