package io.relaypipes.params;

import io.relaypipes.config.PipesConfig;
import io.relaypipes.model.Params;
import io.relaypipes.util.ParamsCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class EnvParamsLoader implements ParamsLoader {
    private static final Logger LOG = LoggerFactory.getLogger(EnvParamsLoader.class);

    private final PipesConfig config;

    public EnvParamsLoader() {
        this(PipesConfig.defaults());
    }

    public EnvParamsLoader(PipesConfig config) {
        this.config = config;
    }

    @Override
    public boolean isActive() {
        return present(config.contextBlob()) && present(config.messagesBlob());
    }

    @Override
    public Params loadContextParams() {
        return load(config.contextEnvVar(), config.contextBlob());
    }

    @Override
    public Params loadMessagesParams() {
        return load(config.messagesEnvVar(), config.messagesBlob());
    }

    private Params load(String name, String blob) {
        if (!present(blob)) {
            throw new ParamsException("Environment variable not set: " + name);
        }
        try {
            Params params = ParamsCodec.decode(blob);
            LOG.debug("Decoded params from environment variable {}", name);
            return params;
        } catch (ParamsException e) {
            throw new ParamsException("Failed to decode environment variable " + name + ": " + e.getMessage(), e);
        }
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
