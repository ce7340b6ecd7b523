package org.janelia.colorcast.cmd;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.io.ImageWriter;
import org.janelia.colorcast.session.ColorTransferSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the transfer once and writes one blended image for every requested intensity.
 */
class SweepCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(SweepCmd.class);

    @Parameters(commandDescription = "Write the transfer result blended at several intensities")
    static class SweepArgs extends AbstractCmdArgs {
        @Parameter(names = {"--intensities", "-i"}, description = "Blend intensities", variableArity = true)
        List<Double> intensities = new ArrayList<>();

        @Parameter(names = {"--output-dir", "-od"}, description = "Output directory")
        String outputDir;

        @Parameter(names = "--output-format", description = "Output image format: png, jpg, bmp or tif. " +
                "If not set the configured default is used.")
        String outputFormat;

        @Parameter(names = "--report", description = "If set, write a JSON report of the generated images to this file")
        String reportFileName;

        SweepArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Override
        List<String> validate() {
            List<String> errors = super.validate();
            if (intensities.isEmpty()) {
                errors.add("At least one intensity is required");
            }
            Map<Long, Double> intensitiesByTag = new HashMap<>();
            for (Double t : intensities) {
                if (t == null || t.isNaN() || t < 0 || t > 1) {
                    errors.add("Intensity must be between 0 and 1: " + t);
                    continue;
                }
                Double previous = intensitiesByTag.putIfAbsent(getIntensityTag(t), t);
                if (previous != null) {
                    errors.add("Intensities " + previous + " and " + t + " would be written to the same output file");
                }
            }
            if (StringUtils.isBlank(outputDir)) {
                errors.add("--output-dir is required");
            }
            return errors;
        }
    }

    static class SweepOutput {
        @JsonProperty
        final double intensity;
        @JsonProperty
        final String imagePath;

        SweepOutput(double intensity, String imagePath) {
            this.intensity = intensity;
            this.imagePath = imagePath;
        }
    }

    static class SweepReport {
        @JsonProperty
        String contentImage;
        @JsonProperty
        String styleImage;
        @JsonProperty
        String method;
        @JsonProperty
        int width;
        @JsonProperty
        int height;
        @JsonProperty
        final List<SweepOutput> outputs = new ArrayList<>();
    }

    private final SweepArgs args;
    private final ObjectMapper mapper;

    SweepCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new SweepArgs(commonArgs);
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    @Override
    SweepArgs getArgs() {
        return args;
    }

    @Override
    void execute() throws IOException {
        long startTime = System.currentTimeMillis();
        ColorTransferSession session = createSession();
        String outputFormat = StringUtils.defaultIfBlank(
                args.outputFormat,
                getConfig().getStringPropertyValue("Output.DefaultFormat", "png"));
        Path outputDir = Paths.get(args.outputDir);
        String baseName = FilenameUtils.getBaseName(args.contentImageName);

        SweepReport report = new SweepReport();
        report.contentImage = args.contentImageName;
        report.styleImage = args.styleImageName;
        report.method = session.getTransferMethod().getId();
        report.width = session.getContentImage().getWidth();
        report.height = session.getContentImage().getHeight();
        for (double intensity : args.intensities) {
            session.setIntensity(intensity);
            // only the first blend computes the transfer, the others reuse the cached result
            ColorImage blended = session.applyTransfer();
            Path outputPath = outputDir.resolve(getOutputFileName(baseName, session.getTransferMethod().getId(), intensity, outputFormat));
            ImageWriter.writeImage(blended, outputPath);
            report.outputs.add(new SweepOutput(intensity, outputPath.toString()));
        }
        if (StringUtils.isNotBlank(args.reportFileName)) {
            writeReport(report, Paths.get(args.reportFileName));
        }
        LOG.info("Generated {} images in {} in {}s",
                report.outputs.size(), outputDir, (System.currentTimeMillis() - startTime) / 1000.);
    }

    static String getOutputFileName(String baseName, String methodId, double intensity, String outputFormat) {
        return String.format(Locale.US, "%s_%s_%03d.%s", baseName, methodId, getIntensityTag(intensity), outputFormat);
    }

    /**
     * Intensity as a whole percentage, used in the output file names.
     */
    static long getIntensityTag(double intensity) {
        return Math.round(intensity * 100);
    }

    private void writeReport(SweepReport report, Path reportPath) throws IOException {
        ObjectWriter writer = args.commonArgs.noPrettyPrint ? mapper.writer() : mapper.writerWithDefaultPrettyPrinter();
        Path reportDir = reportPath.toAbsolutePath().getParent();
        if (reportDir != null) {
            Files.createDirectories(reportDir);
        }
        writer.writeValue(reportPath.toFile(), report);
        LOG.info("Wrote sweep report to {}", reportPath);
    }
}
