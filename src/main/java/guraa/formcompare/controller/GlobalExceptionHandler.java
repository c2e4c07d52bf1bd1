package guraa.formcompare.controller;

import guraa.formcompare.comparison.DuplicateFieldIdException;
import guraa.formcompare.comparison.InvalidFieldRecordException;
import guraa.formcompare.core.DecodeException;
import guraa.formcompare.extraction.NoFormFieldsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle documents that are not decodable PDFs
     * @param e The exception
     * @return Response entity with error message, source name and byte offset if known
     */
    @ExceptionHandler(DecodeException.class)
    public ResponseEntity<Map<String, Object>> handleDecodeException(DecodeException e) {
        logger.warn("Could not decode {}: {}", e.getSourceName(), e.getMessage());
        Map<String, Object> response = new HashMap<>();
        response.put("error", e.getMessage());
        response.put("sourceName", e.getSourceName());
        if (e.getByteOffset() != null) {
            response.put("byteOffset", e.getByteOffset());
        }
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Handle documents without form fields
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(NoFormFieldsException.class)
    public ResponseEntity<Map<String, Object>> handleNoFormFields(NoFormFieldsException e) {
        logger.info("No form fields in {}", e.getSourceName());
        Map<String, Object> response = new HashMap<>();
        response.put("error", e.getMessage());
        response.put("sourceName", e.getSourceName());
        response.put("pageCount", e.getPageCount());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    /**
     * Handle field sets that reuse a field id
     * @param e The exception
     * @return Response entity with error message and the offending id
     */
    @ExceptionHandler(DuplicateFieldIdException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicateFieldId(DuplicateFieldIdException e) {
        logger.warn(e.getMessage());
        Map<String, Object> response = new HashMap<>();
        response.put("error", e.getMessage());
        response.put("fieldId", e.getFieldId());
        response.put("side", e.getSide());
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Handle field sets holding a null record or a record without id
     * @param e The exception
     * @return Response entity with error message, side and list index
     */
    @ExceptionHandler(InvalidFieldRecordException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidFieldRecord(InvalidFieldRecordException e) {
        logger.warn(e.getMessage());
        Map<String, Object> response = new HashMap<>();
        response.put("error", e.getMessage());
        response.put("side", e.getSide());
        response.put("index", e.getIndex());
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Handle request bodies that cannot be parsed
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        Map<String, String> response = new HashMap<>();
        response.put("error", "Malformed request body");
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Handle file upload size exceeded exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleMaxSizeException(MaxUploadSizeExceededException e) {
        logger.error("File size exceeded the maximum limit", e);
        Map<String, String> response = new HashMap<>();
        response.put("error", "File size exceeds the maximum limit");
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(response);
    }

    /**
     * Handle IO exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIOException(IOException e) {
        logger.error("IO Exception", e);
        Map<String, String> response = new HashMap<>();
        response.put("error", "Error processing file: " + e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    /**
     * Handle all other exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        logger.error("Unexpected exception", e);
        Map<String, String> response = new HashMap<>();
        response.put("error", "An unexpected error occurred: " + e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
