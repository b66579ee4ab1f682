package io.relaypipes.params;

import io.relaypipes.config.PipesConfig;
import io.relaypipes.model.Params;
import io.relaypipes.util.ParamsCodec;

import java.util.List;
import java.util.Optional;

/**
 * Reads the params blobs from process arguments, for launchers that pass them as
 * {@code --dagster-pipes-context <blob>} instead of through the environment.
 * Both the spaced and the {@code --flag=blob} forms are accepted.
 */
public final class CliArgsParamsLoader implements ParamsLoader {
    private final List<String> args;

    public CliArgsParamsLoader(String[] args) {
        this(args == null ? List.of() : List.of(args));
    }

    public CliArgsParamsLoader(List<String> args) {
        this.args = args == null ? List.of() : List.copyOf(args);
    }

    @Override
    public boolean isActive() {
        return find(PipesConfig.CONTEXT_CLI_FLAG).isPresent() && find(PipesConfig.MESSAGES_CLI_FLAG).isPresent();
    }

    @Override
    public Params loadContextParams() {
        return load(PipesConfig.CONTEXT_CLI_FLAG);
    }

    @Override
    public Params loadMessagesParams() {
        return load(PipesConfig.MESSAGES_CLI_FLAG);
    }

    private Params load(String flag) {
        String blob = find(flag).orElseThrow(() -> new ParamsException("Argument not provided: " + flag));
        try {
            return ParamsCodec.decode(blob);
        } catch (ParamsException e) {
            throw new ParamsException("Failed to decode argument " + flag + ": " + e.getMessage(), e);
        }
    }

    private Optional<String> find(String flag) {
        String prefix = flag + "=";
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (arg.startsWith(prefix)) {
                String value = arg.substring(prefix.length());
                return value.isBlank() ? Optional.empty() : Optional.of(value);
            }
            if (arg.equals(flag) && i + 1 < args.size()) {
                String value = args.get(i + 1);
                return value.isBlank() ? Optional.empty() : Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
