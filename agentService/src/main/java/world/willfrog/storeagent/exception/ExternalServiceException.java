package world.willfrog.storeagent.exception;

import lombok.Getter;
import world.willfrog.storeagent.common.dto.ResponseCode;

/**
 * A collaborator (marketplace connector, price search, generative text) failed or timed out.
 */
@Getter
public class ExternalServiceException extends StoreAgentException {
    private final String service;

    public ExternalServiceException(String service, String message) {
        super(ResponseCode.EXTERNAL_SERVICE_ERROR, service + ": " + message);
        this.service = service;
    }

    public ExternalServiceException(String service, String message, Throwable cause) {
        super(ResponseCode.EXTERNAL_SERVICE_ERROR, service + ": " + message, cause);
        this.service = service;
    }
}
