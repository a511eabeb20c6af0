package com.example.mcpinvoke.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

public final class Futures {

    private Futures() {
    }

    public static <T> CompletableFuture<T> propagateCancellation(CompletableFuture<T> dependent, Future<?> source) {
        dependent.whenComplete((value, failure) -> {
            if (dependent.isCancelled() && !source.isDone()) {
                source.cancel(true);
            }
        });
        return dependent;
    }
}
