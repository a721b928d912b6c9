package com.aastreli.modelengine.api;

import com.aastreli.modelengine.domain.exception.ArtifactNotFoundException;
import com.aastreli.modelengine.domain.exception.ArtifactStorageException;
import com.aastreli.modelengine.domain.exception.ModelNotLoadedException;
import com.aastreli.modelengine.domain.exception.ModelVersionNotFoundException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage());
        }
        ProblemDetail pd = problem(HttpStatus.BAD_REQUEST, "validation_failed", "Request validation failed");
        pd.setProperty("fields", fields);
        log.info("[Api] 요청 검증 실패: fields={}", fields.keySet());
        return pd;
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolation(ConstraintViolationException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (ConstraintViolation<?> v : e.getConstraintViolations()) {
            fields.put(v.getPropertyPath().toString(), v.getMessage());
        }
        ProblemDetail pd = problem(HttpStatus.BAD_REQUEST, "validation_failed", "Request validation failed");
        pd.setProperty("fields", fields);
        log.info("[Api] 요청 검증 실패: fields={}", fields.keySet());
        return pd;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleBadJson(HttpMessageNotReadableException e) {
        log.info("[Api] 잘못된 JSON 요청: {}", e.getMostSpecificCause().getMessage());
        return problem(HttpStatus.BAD_REQUEST, "malformed_json", "Malformed JSON request body");
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadRequest(Exception e) {
        log.info("[Api] 잘못된 요청: {}", e.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(ModelVersionNotFoundException.class)
    public ProblemDetail handleNotFound(ModelVersionNotFoundException e) {
        log.info("[Api] 모델 버전 없음: {}", e.getMessage());
        return problem(HttpStatus.NOT_FOUND, "model_version_not_found", e.getMessage());
    }

    @ExceptionHandler(ModelNotLoadedException.class)
    public ProblemDetail handleNotLoaded(ModelNotLoadedException e) {
        log.warn("[Api] 모델 미로드 상태에서 예측 요청");
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "model_not_loaded", e.getMessage());
    }

    @ExceptionHandler({ArtifactNotFoundException.class, ArtifactStorageException.class})
    public ProblemDetail handleStorage(RuntimeException e) {
        log.error("[Api] 아티팩트 저장소 오류", e);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "artifact_storage_error", e.getMessage());
    }

    @ExceptionHandler({ErrorResponseException.class, NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class, HttpMediaTypeNotSupportedException.class})
    public ProblemDetail handleSpringErrorResponse(Exception e) {
        ProblemDetail pd = ((ErrorResponse) e).getBody();
        if (pd.getStatus() >= 500) {
            log.error("[Api] 요청 처리 오류: status={}", pd.getStatus(), e);
        } else {
            log.info("[Api] 클라이언트 오류: status={}, detail={}", pd.getStatus(), pd.getDetail());
        }
        return pd;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception e) {
        log.error("[Api] 예상치 못한 오류", e);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected server error");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setTitle(title);
        return pd;
    }
}
