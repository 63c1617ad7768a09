package com.github.salilvnair.convroute.generation.provider;

import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.generation.core.GenerationClient;
import com.github.salilvnair.convroute.generation.core.GenerationException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "convroute.generation", name = "provider", havingValue = "none", matchIfMissing = true)
public class DisabledGenerationClient implements GenerationClient {

    @Override
    public String generate(String prompt) {
        throw new GenerationException(ConvRouteErrorCode.GENERATION_DISABLED,
                ConvRouteErrorCode.GENERATION_DISABLED.defaultMessage());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
