package com.gentoro.substrate.reference;

import com.gentoro.substrate.exception.ErrorDetails;
import com.gentoro.substrate.exception.ExceptionUtil;
import com.gentoro.substrate.exception.SubstrateException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point for tool handlers working with references. Delegates to a {@link ReferenceStore},
 * logs every operation and turns failures into {@link ToolError}s carrying user guidance.
 *
 * <p>Failures are logged and rethrown unchanged; callers decide whether to present them with {@link
 * #toToolError(Throwable)}.
 */
public class ReferenceHandler {
  private static final org.slf4j.Logger log =
      com.gentoro.substrate.logging.LoggingService.getLogger(ReferenceHandler.class);

  private final ReferenceStore store;

  /** A failure in the shape tool responses expect. */
  public record ToolError(ErrorDetails details, String guidance) {}

  public ReferenceHandler(ReferenceStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  public WriteResult createReference(String ref, String content, Map<String, String> metadata) {
    WriteResult result = call("create", ref, () -> store.createOrUpdate(ref, content, metadata));
    log.info(
        "Reference '{}' {} (v{})",
        result.name(),
        result.created() ? "created" : "updated",
        result.version());
    return result;
  }

  public Reference readReference(String ref) {
    Reference reference = call("read", ref, () -> store.read(ref));
    log.info("Reference '{}' read successfully", reference.name());
    return reference;
  }

  public WriteResult updateReference(String ref, String content) {
    WriteResult result = call("update", ref, () -> store.update(ref, content));
    log.info("Reference '{}' updated (v{})", result.name(), result.version());
    return result;
  }

  public DeleteResult deleteReference(String ref) {
    DeleteResult result = call("delete", ref, () -> store.delete(ref));
    log.info("Reference '{}' deleted", result.name());
    return result;
  }

  public List<String> listReferences(String prefix) {
    List<String> refs = call("list", prefix, () -> store.list(prefix));
    log.info(
        "Listed {} references{}",
        refs.size(),
        prefix == null || prefix.isEmpty() ? "" : " with prefix '" + prefix + "'");
    return refs;
  }

  public CleanupResult cleanupReferences(String prefix, Duration maxAge) {
    String effectivePrefix = prefix == null ? ReferenceStore.DEFAULT_CLEANUP_PREFIX : prefix;
    Duration effectiveAge = maxAge == null ? ReferenceStore.DEFAULT_CLEANUP_AGE : maxAge;
    CleanupResult result =
        call("cleanup", effectivePrefix, () -> store.cleanup(effectivePrefix, effectiveAge));
    log.info("Cleanup removed {} references under '{}'", result.removed(), result.prefix());
    return result;
  }

  /** Structured details plus a short hint on what the caller should do next. */
  public ToolError toToolError(Throwable t) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    return new ToolError(details, guidance(details));
  }

  static String guidance(ErrorDetails details) {
    String subject =
        details.isReferenceScoped() ? "'" + details.referenceName + "'" : "the reference";
    return switch (details.code) {
      case REFERENCE_NOT_FOUND -> "Nothing stored under "
          + subject
          + " yet. Create it first, or list references to find the right name.";
      case INVALID_REFERENCE_NAME -> "Use a slash-separated name such as 'prompts/greeting'"
          + " without empty, '.' or '..' segments, backslashes or control characters."
          + " Only the last segment may end in .yaml or .json.";
      case STORAGE_IO_ERROR -> "The reference store could not access its storage. Retry later"
          + " or check free space and permissions of the data directory.";
      case FORMAT_ERROR -> "The stored record for "
          + subject
          + " is damaged. Delete it and create it again.";
      default -> "Unexpected failure: " + details.message;
    };
  }

  private <T> T call(String operation, String ref, Supplier<T> action) {
    try {
      return action.get();
    } catch (SubstrateException e) {
      log.error("Error during {} of reference '{}': {}", operation, ref, e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      log.error("Unexpected error during {} of reference '{}'", operation, ref, e);
      throw e;
    }
  }
}
