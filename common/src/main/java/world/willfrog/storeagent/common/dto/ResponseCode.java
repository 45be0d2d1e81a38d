package world.willfrog.storeagent.common.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Unified response status codes.
 */
@Getter
@AllArgsConstructor
public enum ResponseCode {

    SUCCESS("200", "ok"),

    PARAM_ERROR("400", "invalid parameter"),

    DATA_NOT_FOUND("404", "data not found"),

    DATA_EXIST("409", "data already exists"),

    /**
     * Business rule rejected the request (e.g. action not in an approvable state).
     */
    BUSINESS_ERROR("422", "business error"),

    SYSTEM_ERROR("500", "internal error"),

    SERVICE_UNAVAILABLE("503", "service unavailable"),

    /**
     * A collaborator (marketplace, price search, LLM) failed or timed out.
     */
    EXTERNAL_SERVICE_ERROR("520", "external service error");

    private final String code;

    private final String message;

    public static ResponseCode getByCode(String code) {
        for (ResponseCode responseCode : values()) {
            if (responseCode.getCode().equals(code)) {
                return responseCode;
            }
        }
        return SYSTEM_ERROR;
    }
}
