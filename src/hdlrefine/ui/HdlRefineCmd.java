package hdlrefine.ui;

import hdlrefine.HdlRefine;
import hdlrefine.design.Design;
import hdlrefine.design.DesignException;
import hdlrefine.util.DesignFormatException;
import hdlrefine.util.DesignPrinter;
import hdlrefine.util.DesignReader;
import hdlrefine.util.DesignWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

public class HdlRefineCmd {
  // logging
  protected static Logger logger = null;

  // run() may be called without main() having set up logging
  private static Logger log() {
    if (logger == null)
      logger = LogManager.getLogger(HdlRefineCmd.class);
    return logger;
  }

  // command line options, filled in main()
  static Options options = new Options();

  // help text
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("hdlrefine - refine continuous, blocking and non-blocking assignments into signals, variables and cones", options);
    System.exit(-1);
  };

  public static void main(String[] args) {
    // console logging, the level is set once the options are parsed
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("design.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file describing the design to refine")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file to write the refined design to")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with refinement options")
                          .build());
    options.addOption(Option.builder("p").longOpt("print").required(false).desc("Print the refined design").build());
    options.addOption(Option.builder("n").longOpt("no-normalize").required(false).desc("Do not normalize the design first").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    // options
    String inputFile = "";
    String outputFile = null;
    boolean print = false;
    RefineConfig cfg = new RefineConfig();
    try {
      CommandLine line = parser.parse(options, args);

      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      inputFile = line.getOptionValue("i");
      outputFile = line.getOptionValue("o");
      print = line.hasOption("p");

      // -q, -v and -vv pick the log level
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      if (line.hasOption("c")) {
        cfg = readConfig(new File(line.getOptionValue("c")));
        if (cfg == null)
          System.exit(1);
      }
      if (line.hasOption("n"))
        cfg.normalize = false;
    } catch (ParseException exp) {
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    assert inputFile != null && !inputFile.isEmpty() : "No input design selected!";

    boolean success = run(new File(inputFile), outputFile == null ? null : new File(outputFile), print, cfg);
    System.exit(success ? 0 : 1);
  }

  /**
   * Reads, refines and writes a design.
   * @return true on success; failures are logged
   */
  public static boolean run(File input, File output, boolean print, RefineConfig cfg) {
    Design design;
    try {
      design = DesignReader.read(input);
    } catch (DesignFormatException e) {
      log().error("Cannot read the design: {}", e.getMessage());
      return false;
    }
    try {
      new HdlRefine(cfg).refine(design);
    } catch (DesignException e) {
      log().fatal("Refinement failed: {}", e.getMessage());
      return false;
    }
    if (print)
      System.out.print(DesignPrinter.print(design));
    if (output != null) {
      try (Writer out = new FileWriter(output, StandardCharsets.UTF_8)) {
        DesignWriter.write(design, out);
      } catch (IOException e) {
        log().error("Cannot write {}: {}", output, e.getMessage());
        return false;
      }
      log().info("Wrote refined design to {}", output);
    }
    return true;
  }

  // read the refinement options, unknown keys are an error; returns null if the file is unusable
  static RefineConfig readConfig(File configFile) {
    Yaml yamlConfig = new Yaml(new Constructor(RefineConfig.class, new LoaderOptions()));
    try (InputStream readFile = new FileInputStream(configFile)) {
      RefineConfig cfg = yamlConfig.load(readFile);
      return cfg == null ? new RefineConfig() : cfg;
    } catch (IOException | YAMLException e) {
      log().error("Config yaml file could not be read: {}", e.getMessage());
      return null;
    }
  }
}
