package org.janelia.colorcast.cmd;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;

import org.apache.commons.lang3.StringUtils;
import org.janelia.colorcast.transfer.TransferMethod;

class AbstractCmdArgs {

    @Parameter(names = {"--content", "-c"}, description = "Content image whose colors are replaced")
    String contentImageName;

    @Parameter(names = {"--style", "-s"}, description = "Style image that provides the colors")
    String styleImageName;

    @Parameter(names = {"--method", "-m"}, description = "Transfer method: histogram, meanstd, lut_linear, lut_scurve, " +
            "lut_contrast, selective_shadows, selective_midtones, selective_highlights. " +
            "If not set the configured default is used.")
    String methodId;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;

    final CommonArgs commonArgs;

    AbstractCmdArgs(CommonArgs commonArgs) {
        this.commonArgs = commonArgs;
    }

    String getConfigFileName() {
        return commonArgs.configFileName;
    }

    boolean displayHelp() {
        return displayHelpMessage || commonArgs.displayHelpMessage;
    }

    Path getContentImagePath() {
        return Paths.get(contentImageName);
    }

    Path getStyleImagePath() {
        return Paths.get(styleImageName);
    }

    List<String> validate() {
        List<String> errors = new ArrayList<>();
        checkInputFile("--content", contentImageName, errors);
        checkInputFile("--style", styleImageName, errors);
        if (StringUtils.isNotBlank(methodId)) {
            try {
                TransferMethod.fromId(methodId);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        return errors;
    }

    private void checkInputFile(String argName, String fileName, List<String> errors) {
        if (StringUtils.isBlank(fileName)) {
            errors.add(argName + " is required");
        } else if (!Files.isRegularFile(Paths.get(fileName))) {
            errors.add(argName + " file " + fileName + " does not exist");
        }
    }
}
