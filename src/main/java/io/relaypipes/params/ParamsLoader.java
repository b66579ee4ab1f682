package io.relaypipes.params;

import io.relaypipes.model.Params;

/**
 * Locates and decodes the launcher's bootstrap parameters.
 *
 * <p>Implementations only read process state (environment, arguments); they never write.
 */
public interface ParamsLoader {
    /**
     * @return true when both parameter blobs are present, i.e. the process was launched under the protocol
     */
    boolean isActive();

    /**
     * @throws ParamsException when the blob is absent or does not decode to a JSON object
     */
    Params loadContextParams();

    /**
     * @throws ParamsException when the blob is absent or does not decode to a JSON object
     */
    Params loadMessagesParams();
}
