package org.janelia.colorcast.cmd;

import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 */
public class ColorCastCmd {

    private static final Logger LOG = LoggerFactory.getLogger(ColorCastCmd.class);

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    /**
     * Parse the arguments and run the selected command.
     *
     * @return the process exit status
     */
    static int run(String... argv) {
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new TransferCmd("transfer", commonArgs),
                new SweepCmd("sweep", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .programName("colorcast")
                .addObject(commonArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            cmdline.usage();
            return 1;
        }

        String parsedCommand = cmdline.getParsedCommand();
        if (StringUtils.isBlank(parsedCommand)) {
            cmdline.usage();
            return commonArgs.displayHelpMessage ? 0 : 1;
        }
        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(parsedCommand))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No command registered for " + parsedCommand));
        if (cmd.getArgs().displayHelp()) {
            cmdline.getUsageFormatter().usage(parsedCommand);
            return 0;
        }
        List<String> validationErrors = cmd.getArgs().validate();
        if (!validationErrors.isEmpty()) {
            validationErrors.forEach(System.err::println);
            cmdline.getUsageFormatter().usage(parsedCommand);
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (Exception e) {
            LOG.error("Error running {}", cmd.getCommandName(), e);
            return 1;
        }
    }
}
