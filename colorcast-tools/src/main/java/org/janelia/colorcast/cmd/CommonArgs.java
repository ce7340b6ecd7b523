package org.janelia.colorcast.cmd;

import com.beust.jcommander.Parameter;

class CommonArgs {
    @Parameter(names = "--config", description = "Config file that overrides the default settings")
    String configFileName;

    @Parameter(names = "--no-pretty-print", description = "Do not pretty print the JSON reports", arity = 0)
    boolean noPrettyPrint = false;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
