package com.gentoro.substrate.reference;

import com.gentoro.substrate.Substrate;
import com.gentoro.substrate.exception.ConfigException;
import com.gentoro.substrate.reference.impl.FileSystemReferenceStore;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

public class ReferenceStoreFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.substrate.logging.LoggingService.getLogger(ReferenceStoreFactory.class);

  public static final String STORAGE_ROOT_KEY = "storage.root";
  public static final String DEFAULT_STORAGE_ROOT = "data";

  private ReferenceStoreFactory() {}

  /** Create the store from the "references" namespace of the application configuration. */
  public static ReferenceStore create(Substrate substrate) {
    return create(substrate.configuration().subset("references"));
  }

  /**
   * Create a store using the provided configuration (usually the "references" subset). Supported
   * property: storage.root, either "file:/absolute/path" or a plain path. An unset or unresolved
   * value (e.g. "${env:DATA_DIR}" without DATA_DIR) falls back to "./data".
   */
  public static ReferenceStore create(Configuration referencesCfg) {
    if (referencesCfg == null) {
      throw new ConfigException("References configuration not provided");
    }

    String location = referencesCfg.getString(STORAGE_ROOT_KEY, null);
    if (location == null || location.isBlank() || location.contains("${")) {
      log.warn(
          "references.{} is not set (value: {}); using default '{}'",
          STORAGE_ROOT_KEY,
          location,
          DEFAULT_STORAGE_ROOT);
      location = DEFAULT_STORAGE_ROOT;
    }
    location = location.trim();

    Path root;
    try {
      root = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid reference storage root: " + location, e);
    }

    if (Files.exists(root) && !Files.isDirectory(root)) {
      throw new ConfigException("Reference storage root is not a directory: " + root);
    }
    return new FileSystemReferenceStore(root);
  }
}
