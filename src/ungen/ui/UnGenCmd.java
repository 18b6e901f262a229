package ungen.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import ungen.ExpansionReport;
import ungen.Target;
import ungen.UnGen;
import ungen.UnGenException;
import ungen.expand.InvalidKeepIdException;
import ungen.expand.KeepIds;

public class UnGenCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_USAGE = 2;

  private static final String usage = "ungen <verilog_file> (-s <signal> | -l <line>) [options]";
  private static final String header = "Expand the _GEN signals in the definition of a signal of a generated Verilog file";

  // options for cmdline parser
  static Options options = createOptions();

  private static Options createOptions() {
    Options ret = new Options();
    ret.addOption(Option.builder("s")
                      .longOpt("signal")
                      .argName("name")
                      .hasArg()
                      .required(false)
                      .desc("Signal name to expand (only wire)")
                      .build());
    ret.addOption(Option.builder("l")
                      .longOpt("line")
                      .argName("line")
                      .hasArg()
                      .required(false)
                      .desc("Line number where the signal is assigned (wire or reg)")
                      .build());
    ret.addOption(Option.builder("k")
                      .longOpt("keep")
                      .argName("ids")
                      .hasArg()
                      .required(false)
                      .desc("Comma-separated list of _GEN ids to keep (not expand)")
                      .build());
    ret.addOption(Option.builder("c")
                      .longOpt("config")
                      .argName("config.yaml")
                      .hasArg()
                      .required(false)
                      .desc("YAML file with the generated signal pattern, ids to keep and report sections")
                      .build());
    ret.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    ret.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    ret.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    ret.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return ret;
  }

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(PrintStream out) {
    PrintWriter writer = new PrintWriter(out);
    helper.printHelp(writer, helper.getWidth(), usage, header, options, helper.getLeftPadding(), helper.getDescPadding(), null);
    writer.flush();
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout carries the report
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stderr")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args, System.out, System.err));
  }

  /**
   * Runs the command line tool.
   * @param args command line arguments
   * @param out receives the report and the help text
   * @param err receives usage errors and the reason of a failed expansion, whatever the verbosity
   * @return the exit status
   */
  public static int run(String[] args, PrintStream out, PrintStream err) {
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    String verilogFile;
    Target target;
    Set<Integer> keepIds = new TreeSet<>();
    UnGenConfig config = new UnGenConfig();
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelp(out);
        return EXIT_OK;
      }

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      List<String> positional = line.getArgList();
      if (positional.size() != 1)
        throw new ParseException(positional.isEmpty() ? "Missing Verilog file" : "Only one Verilog file can be processed, got " + positional);
      verilogFile = positional.get(0);

      if (line.hasOption("s") == line.hasOption("l"))
        throw new ParseException("Either --signal or --line must be specified.");
      if (line.hasOption("s")) {
        if (line.getOptionValue("s").isBlank())
          throw new ParseException("Signal name must not be empty");
        target = Target.byName(line.getOptionValue("s").trim());
      } else {
        try {
          target = Target.byLine(Integer.parseInt(line.getOptionValue("l").trim()));
        } catch (IllegalArgumentException e) {
          throw new ParseException("Invalid line number '" + line.getOptionValue("l") + "'");
        }
      }

      if (line.hasOption("c"))
        config = UnGenConfig.load(new File(line.getOptionValue("c")));
      keepIds.addAll(config.getKeepIds());
      keepIds.addAll(KeepIds.parse(line.getOptionValue("k")));
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      err.println(exp.getMessage());
      printHelp(err);
      return EXIT_USAGE;
    } catch (ConfigException | InvalidKeepIdException exp) {
      err.println(exp.getMessage());
      return EXIT_USAGE;
    }

    //////////   invoke the expansion   //////////
    try {
      UnGen ungen = new UnGen(config.createGeneratedSignals());
      ExpansionReport report = ungen.expandSignal(Path.of(verilogFile), target, keepIds);
      out.print(report.format(config.print_original, config.print_generated, config.print_kept));
      out.flush();
      return EXIT_OK;
    } catch (IOException e) {
      err.println("Verilog file " + verilogFile + " could not be read: " + e);
      logger.debug("Reading the Verilog file failed", e);
      return EXIT_FAILURE;
    } catch (UnGenException e) {
      err.println("Cannot expand " + target + ": " + e.getMessage());
      logger.debug("Expansion failed", e);
      return EXIT_FAILURE;
    }
  }
}
