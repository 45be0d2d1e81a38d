package world.willfrog.storeagent.handler;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import world.willfrog.storeagent.common.dto.ResponseCode;
import world.willfrog.storeagent.common.dto.ResponseWrapper;
import world.willfrog.storeagent.common.exception.BizException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BizException.class)
    public ResponseWrapper<Void> handleBizException(BizException ex) {
        if (ex.getCode() == ResponseCode.SYSTEM_ERROR) {
            log.error("System error", ex);
        }
        return ResponseWrapper.error(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class,
            HttpMessageNotReadableException.class, MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseWrapper<Void> handleValidations(Exception ex) {
        return ResponseWrapper.error(ResponseCode.PARAM_ERROR, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseWrapper<Void> handleOther(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseWrapper.error(ResponseCode.SYSTEM_ERROR, "internal error, please retry later");
    }
}
