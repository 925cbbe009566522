package org.fpbeditor.layout;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;
import org.fpbeditor.common.ModelFormatException;
import org.fpbeditor.common.ProcessModel;

/**
 * Command line entry: reads a process model in JSON, lays it out and writes the diagram as JSON.
 */
public class LayoutGenerator {

  private static final String ARG_INPUT = "i";
  private static final String ARG_OUTPUT = "o";
  private static final String ARG_CONFIG = "c";
  private static final String ARG_PADDING = "p";
  private static final String ARG_H_GAP = "x";
  private static final String ARG_V_GAP = "y";
  private static final String ARG_SYSTEM_PADDING = "s";
  private static final String ARG_RESOURCE_OFFSET = "r";

  private static final int INDENT = 2;

  private static final Logger logger = Logger.getLogger(LayoutGenerator.class);

  public static void main(String[] args) {
    Options options = prepareOptions();
    CommandLineParser parser = new DefaultParser();
    try {
      CommandLine commandLine = parser.parse(options, args);
      LayoutGenerator generator = new LayoutGenerator(commandLine);
      generator.process();
    }
    catch (ParseException | IllegalArgumentException ex) {
      System.err.println(ex.getMessage());
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp("fpb-layout", options);
      System.exit(-1);
    }
    catch (IOException | ModelFormatException ex) {
      logger.error("Layout failed: " + ex.getMessage(), ex);
      System.exit(-1);
    }
  }

  static Options prepareOptions() {
    Options options = new Options();

    options.addOption(Option.builder(ARG_INPUT)
        .argName("model.json")
        .desc("The process model to lay out")
        .required()
        .hasArg()
        .build());

    options.addOption(Option.builder(ARG_OUTPUT)
        .argName("diagram.json")
        .desc("The file to write the diagram to. Default is the standard output")
        .hasArg()
        .build());

    options.addOption(Option.builder(ARG_CONFIG)
        .argName("layout.properties")
        .desc("Properties file with " + LayoutConfig.ARTIFACT_ID + ".* layout settings")
        .hasArg()
        .build());

    options.addOption(spacingOption(ARG_PADDING, "Padding around the diagram. Default is "
        + LayoutConfig.DEFAULT_PADDING));
    options.addOption(spacingOption(ARG_H_GAP, "Horizontal gap between elements. Default is "
        + LayoutConfig.DEFAULT_H_GAP));
    options.addOption(spacingOption(ARG_V_GAP, "Vertical gap between rank rows. Default is "
        + LayoutConfig.DEFAULT_V_GAP));
    options.addOption(spacingOption(ARG_SYSTEM_PADDING,
        "Padding inside each system boundary. Default is " + LayoutConfig.DEFAULT_SYSTEM_PADDING));
    options.addOption(spacingOption(ARG_RESOURCE_OFFSET,
        "Distance of technical resources from the system boundary. Default is "
            + LayoutConfig.DEFAULT_RESOURCE_OFFSET));
    return options;
  }

  private static Option spacingOption(String name, String description) {
    return Option.builder(name).argName("number").desc(description).hasArg().build();
  }

  private final File input;
  private final File output;
  private final LayoutConfig config;

  public LayoutGenerator(CommandLine commandLine) throws IOException {
    logger.info("Initializing Layout Generator...");

    input = new File(commandLine.getOptionValue(ARG_INPUT));
    String outputName = commandLine.getOptionValue(ARG_OUTPUT);
    output = (outputName == null) ? null : new File(outputName);
    config = createConfig(commandLine);
  }

  private LayoutConfig createConfig(CommandLine commandLine) throws IOException {
    Properties properties = new Properties();
    String configFile = commandLine.getOptionValue(ARG_CONFIG);
    if (configFile != null) {
      logger.info("Reading layout settings from " + configFile);
      InputStream stream = new FileInputStream(configFile);
      try {
        properties.load(stream);
      }
      finally {
        stream.close();
      }
    }

    // command line values override the file
    override(properties, commandLine, ARG_PADDING, LayoutConfig.PROP_PADDING);
    override(properties, commandLine, ARG_H_GAP, LayoutConfig.PROP_H_GAP);
    override(properties, commandLine, ARG_V_GAP, LayoutConfig.PROP_V_GAP);
    override(properties, commandLine, ARG_SYSTEM_PADDING, LayoutConfig.PROP_SYSTEM_PADDING);
    override(properties, commandLine, ARG_RESOURCE_OFFSET, LayoutConfig.PROP_RESOURCE_OFFSET);
    return LayoutConfig.fromProperties(properties);
  }

  private static void override(Properties properties, CommandLine commandLine, String option,
      String property) {
    String value = commandLine.getOptionValue(option);
    if (value != null)
      properties.setProperty(property, value);
  }

  public LayoutConfig getConfig() {
    return config;
  }

  public Diagram process() throws IOException, ModelFormatException {
    logger.info("Start processing " + input + " with " + config);

    long start = System.currentTimeMillis();
    String json = new String(Files.readAllBytes(input.toPath()), StandardCharsets.UTF_8);
    ProcessModel model = ProcessModel.parse(json);
    long loading = System.currentTimeMillis() - start;

    start = System.currentTimeMillis();
    Diagram diagram = new VerticalFlowLayout(config).process(model);
    long processing = System.currentTimeMillis() - start;

    start = System.currentTimeMillis();
    write(diagram);
    long saving = System.currentTimeMillis() - start;

    logger.info("Layout finished. " + diagram.getElements().size() + " elements, loading="
        + loading + ", processing=" + processing + ", saving=" + saving);
    for (String warning : model.getWarnings()) {
      logger.warn("Model warning: " + warning);
    }
    return diagram;
  }

  private void write(Diagram diagram) throws IOException {
    String text = diagram.toJSON().toString(INDENT);
    if (output == null) {
      PrintStream out = System.out;
      out.println(text);
      out.flush();
      return;
    }
    Writer writer = new OutputStreamWriter(Files.newOutputStream(output.toPath()),
        StandardCharsets.UTF_8);
    try {
      writer.write(text);
    }
    finally {
      writer.close();
    }
  }
}
