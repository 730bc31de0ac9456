package com.gentoro.substrate;

import com.gentoro.substrate.exception.StateException;
import com.gentoro.substrate.reference.ReferenceHandler;
import com.gentoro.substrate.reference.ReferenceStore;
import com.gentoro.substrate.reference.ReferenceStoreFactory;
import org.apache.commons.configuration2.Configuration;

/**
 * Composition root. Loads configuration, applies logging levels and builds one {@link
 * ReferenceStore} plus its {@link ReferenceHandler}; feature modules receive those instances
 * explicitly.
 */
public class Substrate {

  private static final org.slf4j.Logger log =
      com.gentoro.substrate.logging.LoggingService.getLogger(Substrate.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ReferenceStore referenceStore;
  private ReferenceHandler referenceHandler;

  public Substrate(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.substrate.logging.LoggingService.applyConfiguration(configuration());

    startupParameters
        .dataDir()
        .ifPresent(
            dir -> {
              log.info("Using storage root from command line: {}", dir);
              configuration().setProperty("references.storage.root", dir);
            });

    this.referenceStore = ReferenceStoreFactory.create(this);
    this.referenceHandler = new ReferenceHandler(referenceStore);
    log.info("Substrate initialized");
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Substrate has not been initialized");
    }
    return configurationProvider.config();
  }

  public ReferenceStore referenceStore() {
    if (referenceStore == null) {
      throw new StateException("Substrate has not been initialized");
    }
    return referenceStore;
  }

  public ReferenceHandler referenceHandler() {
    if (referenceHandler == null) {
      throw new StateException("Substrate has not been initialized");
    }
    return referenceHandler;
  }
}
