package world.willfrog.storeagent.common.exception;

import lombok.Getter;
import world.willfrog.storeagent.common.dto.ResponseCode;

@Getter
public class BizException extends RuntimeException {
    private final ResponseCode code;

    public BizException(ResponseCode code, String message) {
        super(message);
        this.code = code;
    }

    public BizException(ResponseCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
