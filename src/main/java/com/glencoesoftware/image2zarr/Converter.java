/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.image2zarr;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.glencoesoftware.image2zarr.fits.FitsArtifactOpener;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line tool for converting radio astronomy images and their
 * auxiliary artifacts to Zarr.
 *
 * Artifacts are found next to the input by replacing its extension with
 * the artifact type, e.g. "cube.mask" for "cube.fits".  Artifacts with the
 * same shape as the input are written to one store; every other artifact
 * is written to its own store.
 */
public class Converter implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  /** Extension of generated stores. */
  public static final String ZARR_EXTENSION = ".zarr";

  /** Artifact types converted by default, in priority order. */
  public static final List<String> DEFAULT_ARTIFACTS =
    Collections.unmodifiableList(Arrays.asList(
      "mask", "model", "pb", "psf", "residual", "sumwt"));

  /** Data variable name used for a FITS primary image. */
  public static final String IMAGE_VARIABLE = "image";

  private volatile String inputLocation;
  private volatile String outputLocation;
  private volatile List<String> artifacts =
    new ArrayList<String>(DEFAULT_ARTIFACTS);

  private volatile String logLevel = "WARN";
  private volatile boolean progressBars = false;
  private volatile boolean printVersion = false;
  private volatile boolean help = false;

  private volatile ZarrCompression compressionType = ZarrCompression.blosc;

  private ArtifactOpener artifactOpener;
  private ArrayStore arrayStore;
  private IProgressListener progressListener;

  // Option setters

  /**
   * @param input path to the input image
   */
  @Parameters(
    index = "0",
    arity = "1",
    description = "image to convert; artifacts are found by " +
      "replacing its extension with the artifact type",
    defaultValue = Option.NULL_VALUE
  )
  public void setInputPath(String input) {
    inputLocation = input;
  }

  /**
   * @param output path to the output store
   */
  @Parameters(
    index = "1",
    arity = "0..1",
    description = "path to the output Zarr store " +
      "(default: input with its extension replaced by .zarr). " +
      "Artifacts with a different shape are written next to it, " +
      "as <output>.<type>.zarr",
    defaultValue = Option.NULL_VALUE
  )
  public void setOutputPath(String output) {
    outputLocation = output;
  }

  /**
   * Define the auxiliary artifact types to convert if present.
   *
   * @param types artifact type list
   */
  @Option(
    names = "--artifacts",
    split = ",",
    description = "Comma-separated list of artifact types to include " +
      "if present (default: ${DEFAULT-VALUE})",
    defaultValue = "mask,model,pb,psf,residual,sumwt"
  )
  public void setArtifacts(List<String> types) {
    if (types != null) {
      artifacts = new ArrayList<String>(types);
    }
    else {
      artifacts = new ArrayList<String>();
    }
  }

  /**
   * Set the compression type for the output Zarr. Defaults to blosc.
   *
   * @param compression compression type
   */
  @Option(
    names = {"-c", "--compression"},
    description = "Compression type for Zarr " +
      "(${COMPLETION-CANDIDATES}; default: ${DEFAULT-VALUE})",
    defaultValue = "blosc"
  )
  public void setCompression(ZarrCompression compression) {
    if (compression != null) {
      compressionType = compression;
    }
  }

  /**
   * Set the slf4j logging level. Defaults to "WARN".
   *
   * @param level logging level
   */
  @Option(
    names = {"--log-level", "--debug"},
    arity = "0..1",
    description = "Change logging level; valid values are " +
      "OFF, ERROR, WARN, INFO, DEBUG, TRACE and ALL. " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "WARN",
    fallbackValue = "DEBUG"
  )
  public void setLogLevel(String level) {
    if (level != null) {
      logLevel = level;
    }
  }

  /**
   * Configure whether or not progress bars are shown during conversion.
   * Progress bars are turned off by default.
   *
   * @param useProgressBars whether or not to show progress bars
   */
  @Option(
    names = {"-p", "--progress"},
    description = "Print progress bars during conversion",
    defaultValue = "false"
  )
  public void setProgressBars(boolean useProgressBars) {
    progressBars = useProgressBars;
  }

  /**
   * Configure whether to print version information and exit
   * without converting.
   *
   * @param versionOnly whether or not to print version information and exit
   */
  @Option(
    names = "--version",
    description = "Print version information and exit",
    help = true,
    defaultValue = "false"
  )
  public void setPrintVersionOnly(boolean versionOnly) {
    printVersion = versionOnly;
  }

  /**
   * Configure whether to print help and exit without converting.
   *
   * @param helpOnly whether or not to print help and exit
   */
  @Option(
    names = "--help",
    description = "Print usage information and exit",
    usageHelp = true,
    defaultValue = "false"
  )
  public void setHelp(boolean helpOnly) {
    help = helpOnly;
  }

  // Option getters

  /**
   * @return path to input image
   */
  public String getInputPath() {
    return inputLocation;
  }

  /**
   * @return path to output store, or null if derived from the input
   */
  public String getOutputPath() {
    return outputLocation;
  }

  /**
   * @return auxiliary artifact types
   */
  public List<String> getArtifacts() {
    return Collections.unmodifiableList(artifacts);
  }

  /**
   * @return compression type
   */
  public ZarrCompression getCompression() {
    return compressionType;
  }

  /**
   * @return slf4j logging level
   */
  public String getLogLevel() {
    return logLevel;
  }

  /**
   * @return true if progress bars are displayed
   */
  public boolean getProgressBars() {
    return progressBars;
  }

  /**
   * @return true if only version info is displayed
   */
  public boolean getPrintVersionOnly() {
    return printVersion;
  }

  /**
   * @return true if only usage info is displayed
   */
  public boolean getHelp() {
    return help;
  }

  // Conversion methods

  /**
   * @return 0 if conversion completed without error,
   *         -1 if conversion was not performed
   * @throws Exception on most conversion errors
   */
  @Override
  public Integer call() throws Exception {
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
        LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.toLevel(logLevel));

    if (help) {
      return -1;
    }

    if (printVersion) {
      String version = Optional.ofNullable(
        this.getClass().getPackage().getImplementationVersion()
        ).orElse("development");
      System.out.println("Version = " + version);
      return -1;
    }

    if (inputLocation == null) {
      throw new IllegalArgumentException("Input path not specified");
    }

    if (progressBars) {
      setProgressListener(new ProgressBarListener(logLevel));
    }

    convert();
    return 0;
  }

  /**
   * Convert the input image and its artifacts according to the specified
   * command line arguments.  Stores that were completed before a failure
   * are left in place.
   *
   * @throws IOException if an artifact cannot be read or a store cannot
   *         be written
   * @throws CoordinateException if an artifact's world coordinates
   *         cannot be resolved
   */
  public void convert() throws IOException, CoordinateException {
    String input = stripTrailingSeparators(expandHome(inputLocation));
    int dot = input.lastIndexOf('.');
    if (dot <= input.lastIndexOf('/') + 1 || dot == input.length() - 1) {
      throw new IllegalArgumentException(
        "Input path " + input + " has no extension");
    }
    String prefix = input.substring(0, dot);
    String suffix = input.substring(dot + 1);
    Path output = getOutput(prefix);

    List<String> types = new ArrayList<String>();
    types.add(suffix);
    types.addAll(artifacts);

    ArtifactGroups groups =
      new CompatibilityGrouper(getArtifactOpener()).group(prefix, types);
    LOGGER.info("compatible components: {}", groups.getCompatible());
    LOGGER.info("separate components: {}", groups.getDivergentTypes());

    // groups without a frequency axis fail when they are written, after
    // the groups before them are complete
    ArtifactMetadata reference = groups.getReference();
    long channelCount = channelCount(reference);
    for (DivergentArtifact d : groups.getDivergent()) {
      channelCount += channelCount(d.getMetadata());
    }
    getProgressListener().notifyStart(
      groups.getDivergent().size() + 1, channelCount);

    ChannelWriter writer = new ChannelWriter(getArtifactOpener(),
      getArrayStore(), compressionType, getProgressListener());

    Map<String, ArtifactLocation> compatible =
      new LinkedHashMap<String, ArtifactLocation>();
    for (String type : groups.getCompatible()) {
      compatible.put(variableName(type), new ArtifactLocation(
        type, CompatibilityGrouper.artifactPath(prefix, type)));
    }
    Slf4JStopWatch t0 = new Slf4JStopWatch(LOGGER, Slf4JStopWatch.INFO_LEVEL);
    writer.write(suffix, reference, compatible, output);
    t0.stop("write." + suffix);
    LOGGER.info("processed image size {} in {} seconds",
      Arrays.toString(reference.getShape()), t0.getElapsedTime() / 1000.0);

    for (DivergentArtifact d : groups.getDivergent()) {
      String type = d.getType();
      Map<String, ArtifactLocation> single =
        Collections.singletonMap(variableName(type), new ArtifactLocation(
          type, CompatibilityGrouper.artifactPath(prefix, type)));
      Path divergentOutput = getDivergentOutput(output, type);
      LOGGER.info("writing {} to {}", type, divergentOutput);
      writer.write(type, d.getMetadata(), single, divergentOutput);
    }
    LOGGER.info("complete");
  }

  /**
   * @param prefix input path without its extension
   * @return configured output path, or the prefix with a .zarr extension
   */
  private Path getOutput(String prefix) {
    if (outputLocation == null) {
      return Paths.get(prefix + ZARR_EXTENSION);
    }
    return Paths.get(expandHome(outputLocation));
  }

  /**
   * Derive the store for an artifact that does not share the
   * input's shape.
   *
   * @param output primary output store
   * @param type artifact type name
   * @return sibling store named <code>&lt;output&gt;.type.zarr</code>
   */
  public static Path getDivergentOutput(Path output, String type) {
    String name = output.toString();
    if (name.endsWith(ZARR_EXTENSION)) {
      name = name.substring(0, name.length() - ZARR_EXTENSION.length());
    }
    return Paths.get(name + "." + type + ZARR_EXTENSION);
  }

  /**
   * @param type artifact type name
   * @return data variable name for the artifact
   */
  public static String variableName(String type) {
    return "fits".equals(type) ? IMAGE_VARIABLE : type;
  }

  private static long channelCount(ArtifactMetadata metadata) {
    int axis = metadata.getDims().indexOf(ChannelWriter.FREQUENCY);
    return axis < 0 ? 0 : metadata.getShape()[axis];
  }

  private static String expandHome(String path) {
    if (path.equals("~") || path.startsWith("~/")) {
      return System.getProperty("user.home") + path.substring(1);
    }
    return path;
  }

  private static String stripTrailingSeparators(String path) {
    String stripped = path;
    while (stripped.length() > 1 && stripped.endsWith("/")) {
      stripped = stripped.substring(0, stripped.length() - 1);
    }
    return stripped;
  }

  /**
   * Set the factory used to open artifacts.
   *
   * @param opener artifact factory
   */
  public void setArtifactOpener(ArtifactOpener opener) {
    artifactOpener = opener;
  }

  /**
   * Get the factory used to open artifacts.
   * If no factory was set, FITS files are opened.
   *
   * @return the current artifact factory
   */
  public ArtifactOpener getArtifactOpener() {
    if (artifactOpener == null) {
      setArtifactOpener(new FitsArtifactOpener());
    }
    return artifactOpener;
  }

  /**
   * Set the store to which channels are written.
   *
   * @param store output store implementation
   */
  public void setArrayStore(ArrayStore store) {
    arrayStore = store;
  }

  /**
   * Get the store to which channels are written.
   * If no store was set, Zarr is written.
   *
   * @return the current output store implementation
   */
  public ArrayStore getArrayStore() {
    if (arrayStore == null) {
      setArrayStore(new ZarrArrayStore());
    }
    return arrayStore;
  }

  /**
   * Set a listener for channel processing events.
   * Intended to be used to show a status bar.
   *
   * @param listener a progress event listener
   */
  public void setProgressListener(IProgressListener listener) {
    progressListener = listener;
  }

  /**
   * Get the currrent listener for channel processing events.
   * If no listener was set, a no-op listener is returned.
   *
   * @return the current progress listener
   */
  public IProgressListener getProgressListener() {
    if (progressListener == null) {
      setProgressListener(new NoOpProgressListener());
    }
    return progressListener;
  }

  /**
   * Perform file conversion as specified by command line arguments.
   * @param args command line arguments
   */
  public static void main(String[] args) {
    int exitCode = new CommandLine(new Converter()).execute(args);
    System.exit(exitCode);
  }

}
