package com.resumebuilder;

import static spark.Spark.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import spark.Request;
import spark.Response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.resumebuilder.extract.ExtractionReport;
import com.resumebuilder.render.OutputFormat;

/**
 * Thin HTTP surface over {@link ResumeService}. Every failure of the core becomes a JSON
 * error body with the status from {@link #statusFor(ErrorKind)}.
 */
public class ResumeServer {
  private static final Logger LOGGER = LoggerFactory.getLogger(ResumeServer.class);

  static final int DEFAULT_PORT = 4567;
  static final int DEFAULT_MAX_UPLOAD_BYTES = 10 * 1024 * 1024;
  private static final String JSON = "application/json";

  private final ResumeService service;
  private final int maxUploadBytes;

  public ResumeServer(ResumeService service, int maxUploadBytes) {
    this.service = service;
    this.maxUploadBytes = maxUploadBytes;
  }

  static int statusFor(ErrorKind kind) {
    switch (kind) {
      case UNSUPPORTED_FORMAT:
        return 415;
      case CORRUPT_DOCUMENT:
      case EMPTY_DOCUMENT:
        return 422;
      case UNKNOWN_LAYOUT:
        return 404;
      default:
        return 500;
    }
  }

  static String errorBody(String error, String message) {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("error", error);
    body.put("message", message);
    try {
      return Resources.MAPPER.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * Reads an integer setting from a system property, then an environment variable.
   */
  static int setting(String property, String environment, int fallback) {
    String value = System.getProperty(property);
    if (value == null && environment != null) {
      value = System.getenv(environment);
    }
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      LOGGER.warn("Ignoring non-numeric setting {}={}, using {}", property, value, fallback);
      return fallback;
    }
  }

  private Object listLayouts(Request req, Response res) throws JsonProcessingException {
    res.type(JSON);
    return Resources.MAPPER.writeValueAsString(service.layouts());
  }

  private Object parseResume(Request req, Response res) throws JsonProcessingException {
    byte[] body = req.bodyAsBytes();
    if (body != null && body.length > maxUploadBytes) {
      LOGGER.warn("Rejected upload of {} bytes, limit is {}", body.length, maxUploadBytes);
      halt(413, errorBody("PAYLOAD_TOO_LARGE", "Uploads are limited to " + maxUploadBytes + " bytes"));
    }
    String declared = req.queryParams("filename");
    if (declared == null) {
      declared = req.contentType();
    }

    ExtractionReport report = service.extract(body, declared);
    res.type(JSON);
    return Resources.MAPPER.writeValueAsString(report);
  }

  private Object renderResume(Request req, Response res) {
    Entity.RenderRequest request;
    try {
      request = Resources.MAPPER.readValue(req.body(), Entity.RenderRequest.class);
    } catch (JsonProcessingException e) {
      LOGGER.warn("Tried to render invalid resume json", e);
      halt(400, errorBody("BAD_REQUEST", "Request body is not a valid render request"));
      return null;
    }
    if (request == null) {
      halt(400, errorBody("BAD_REQUEST", "Request body is empty"));
      return null;
    }

    OutputFormat format = OutputFormat.fromId(request.format);
    byte[] document = service.render(request.resume, request.layoutId, format.id);
    res.type(format.mediaType);
    res.header("Content-Disposition", "attachment; filename=curriculo-" + request.layoutId + "." + format.id);
    return document;
  }

  public void start(int port) {
    port(port);

    exception(ResumeException.class, (e, req, res) -> {
      res.status(statusFor(e.getKind()));
      res.type(JSON);
      res.body(errorBody(e.getKind().name(), e.getMessage()));
    });

    get("/health", (req, res) -> {
      res.type(JSON);
      return "{\"status\":\"ok\"}";
    });
    get("/templates", this::listLayouts);
    post("/resume/parse", this::parseResume);
    post("/resume/render", this::renderResume);

    LOGGER.info("Resume server listening on port {}", port);
  }

  public static void main(String[] args) {
    int port = setting("resume.port", "PORT", DEFAULT_PORT);
    int maxUpload = setting("resume.maxUploadBytes", null, DEFAULT_MAX_UPLOAD_BYTES);
    new ResumeServer(new ResumeService(), maxUpload).start(port);
  }
}
