package dev.harvester.config;

import dev.harvester.task.TaskNotFoundException;
import dev.harvester.task.UnsupportedFeatureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * Maps a request for an unsupported capability (LLM extraction) to 400 Bad Request.
   *
   * @param ex the rejection raised at submission
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(UnsupportedFeatureException.class)
  ProblemDetail handleUnsupportedFeature(UnsupportedFeatureException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setTitle("Unsupported feature");
    return problem;
  }

  /**
   * Maps an unknown task id to 404 Not Found.
   *
   * @param ex the lookup failure
   * @return a Problem Detail with HTTP 404 status and the missing id
   */
  @ExceptionHandler(TaskNotFoundException.class)
  ProblemDetail handleTaskNotFound(TaskNotFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setProperty("task_id", ex.getTaskId());
    return problem;
  }

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }
}
