package world.willfrog.agentguard.killswitch.handler;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import world.willfrog.agentguard.common.dto.ResponseCode;
import world.willfrog.agentguard.common.dto.ResponseWrapper;
import world.willfrog.agentguard.killswitch.exception.AgentStateException;
import world.willfrog.agentguard.killswitch.exception.BizException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BizException.class)
    public ResponseEntity<ResponseWrapper<Void>> handleBizException(BizException ex) {
        return respond(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class,
            HttpMessageNotReadableException.class, MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ResponseWrapper<Void>> handleValidations(Exception ex) {
        return respond(ResponseCode.PARAM_ERROR, ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ResponseWrapper<Void>> handleDataAccess(DataAccessException ex) {
        log.error("Ledger access failed", ex);
        return respond(ResponseCode.SERVICE_UNAVAILABLE, "存储暂不可用，请稍后重试");
    }

    @ExceptionHandler(AgentStateException.class)
    public ResponseEntity<ResponseWrapper<Void>> handleAgentState(AgentStateException ex) {
        log.error("Agent state invariant violated", ex);
        return respond(ResponseCode.SYSTEM_ERROR, "系统异常，请稍后再试");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ResponseWrapper<Void>> handleOther(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(ResponseCode.SYSTEM_ERROR, "系统异常，请稍后再试");
    }

    private ResponseEntity<ResponseWrapper<Void>> respond(ResponseCode code, String message) {
        return ResponseEntity.status(code.httpStatus()).body(ResponseWrapper.error(code, message));
    }
}
