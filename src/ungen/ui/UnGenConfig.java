package ungen.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import ungen.expand.GeneratedSignals;
import ungen.expand.InvalidKeepIdException;
import ungen.expand.KeepIds;

/**
 * Data-Class to hold tool options, loaded from a YAML file whose keys are the field names.
 */
public class UnGenConfig {

  /** Whole-name regex of generated signals, capture group 1 is the id. */
  public String generated_pattern = GeneratedSignals.DEFAULT_PATTERN;
  /** Generated ids that are never expanded, in addition to the ones given on the command line. */
  public List<Object> keep = new ArrayList<>();

  public boolean print_original = true;
  public boolean print_generated = true;
  public boolean print_kept = true;

  /**
   * Loads a configuration file. An empty file gives the defaults.
   * @throws ConfigException if the file cannot be read, has unknown keys or values of the wrong type
   */
  public static UnGenConfig load(File configFile) throws ConfigException {
    Yaml yaml = new Yaml(new Constructor(UnGenConfig.class, new LoaderOptions()));
    UnGenConfig ret;
    try (InputStream readFile = new FileInputStream(configFile)) {
      ret = yaml.load(readFile);
    } catch (IOException e) {
      throw new ConfigException("Configuration file " + configFile + " could not be read", e);
    } catch (YAMLException | ClassCastException e) {
      throw new ConfigException("Invalid configuration file " + configFile + ": " + e.getMessage(), e);
    }
    if (ret == null)
      ret = new UnGenConfig();
    if (ret.keep == null)
      ret.keep = new ArrayList<>();
    ret.createGeneratedSignals(); // validates the pattern
    ret.getKeepIds();
    return ret;
  }

  /** @throws ConfigException if generated_pattern is no valid regex with a capture group */
  public GeneratedSignals createGeneratedSignals() throws ConfigException {
    if (generated_pattern == null)
      throw new ConfigException("generated_pattern must not be empty");
    try {
      return new GeneratedSignals(generated_pattern);
    } catch (IllegalArgumentException e) {
      throw new ConfigException(e.getMessage(), e);
    }
  }

  /** @throws ConfigException if an entry of keep is not a non-negative integer */
  public Set<Integer> getKeepIds() throws ConfigException {
    try {
      return KeepIds.of(keep);
    } catch (InvalidKeepIdException e) {
      throw new ConfigException("keep: " + e.getMessage(), e);
    }
  }
}
