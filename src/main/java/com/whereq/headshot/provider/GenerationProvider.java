package com.whereq.headshot.provider;

import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * External image generation service. Calls take seconds to minutes and may fail; callers apply
 * their own timeout.
 */
public interface GenerationProvider {
    /**
     * Generate styled outputs for one image
     *
     * @param request the generation call
     * @param onHandleAssigned receives the provider handle as soon as the call is accepted
     * @return Mono with the result, or a ProviderException
     */
    Mono<GenerationResult> generate(GenerationRequest request, Consumer<String> onHandleAssigned);

    default Mono<GenerationResult> generate(GenerationRequest request) {
        return generate(request, handle -> { });
    }

    /**
     * Best-effort request to stop a call in flight
     *
     * @param handle provider handle
     * @return Mono that completes when the provider acknowledged
     */
    default Mono<Void> cancel(String handle) {
        // Default: no-op
        return Mono.empty();
    }
}
