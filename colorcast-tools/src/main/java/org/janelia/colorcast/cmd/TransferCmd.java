package org.janelia.colorcast.cmd;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

import org.apache.commons.lang3.StringUtils;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.io.ImageWriter;
import org.janelia.colorcast.session.ColorTransferSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transfers the colors of the style image to the content image and saves the blended result.
 */
class TransferCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(TransferCmd.class);

    @Parameters(commandDescription = "Transfer the colors of a style image to a content image")
    static class TransferArgs extends AbstractCmdArgs {
        @Parameter(names = {"--intensity", "-i"}, description = "Blend intensity between 0 (content only) and 1 (full transfer). " +
                "If not set the configured default is used.")
        Double intensity;

        @Parameter(names = {"--output", "-o"}, description = "Output image file; the format is given by the extension")
        String outputFileName;

        TransferArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Override
        List<String> validate() {
            List<String> errors = super.validate();
            if (intensity != null && (intensity.isNaN() || intensity < 0 || intensity > 1)) {
                errors.add("--intensity must be between 0 and 1: " + intensity);
            }
            if (StringUtils.isBlank(outputFileName)) {
                errors.add("--output is required");
            }
            return errors;
        }
    }

    private final TransferArgs args;

    TransferCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new TransferArgs(commonArgs);
    }

    @Override
    TransferArgs getArgs() {
        return args;
    }

    @Override
    void execute() throws IOException {
        long startTime = System.currentTimeMillis();
        ColorTransferSession session = createSession();
        if (args.intensity != null) {
            session.setIntensity(args.intensity);
        }
        ColorImage result = session.applyTransfer();
        ImageWriter.writeImage(result, Paths.get(args.outputFileName));
        LOG.info("Transferred colors from {} to {} using {} at {}% intensity in {}s",
                args.styleImageName, args.contentImageName,
                session.getTransferMethod().getDisplayName(),
                Math.round(session.getIntensity() * 100),
                (System.currentTimeMillis() - startTime) / 1000.);
    }
}
