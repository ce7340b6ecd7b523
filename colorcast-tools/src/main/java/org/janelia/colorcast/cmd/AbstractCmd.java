package org.janelia.colorcast.cmd;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.commons.lang3.StringUtils;
import org.janelia.colorcast.config.Config;
import org.janelia.colorcast.config.ConfigProvider;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.io.ImageReader;
import org.janelia.colorcast.session.ColorTransferSession;
import org.janelia.colorcast.transfer.TransferMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractCmd.class);

    private final String commandName;
    private Config config;

    AbstractCmd(String commandName) {
        this.commandName = commandName;
        this.config = null;
    }

    public String getCommandName() {
        return commandName;
    }

    abstract AbstractCmdArgs getArgs();

    boolean matches(String commandName) {
        return StringUtils.isNotBlank(commandName) && StringUtils.equals(this.commandName, commandName);
    }

    abstract void execute() throws IOException;

    Config getConfig() {
        if (config == null) {
            config = ConfigProvider.getInstance()
                    .fromDefaultResources()
                    .fromFile(getArgs().getConfigFileName())
                    .get();
        }
        return config;
    }

    /**
     * Create a session with the configured defaults and load the content and the style images into it.
     */
    ColorTransferSession createSession() throws IOException {
        ColorTransferSession session = ColorTransferSession.fromConfig(getConfig());
        if (StringUtils.isNotBlank(getArgs().methodId)) {
            session.setTransferMethod(TransferMethod.fromId(getArgs().methodId));
        }
        session.setContentImage(readSourceImage("Content", getArgs().getContentImagePath()));
        session.setStyleImage(readSourceImage("Style", getArgs().getStyleImagePath()));
        return session;
    }

    private ColorImage readSourceImage(String role, Path imagePath) throws IOException {
        ColorImage image = ImageReader.readImage(imagePath);
        if (image.getSourceChannels() == 1) {
            LOG.info("{} image {}: grayscale converted to RGB", role, imagePath);
        } else if (image.getSourceChannels() == 4) {
            LOG.info("{} image {}: alpha channel removed", role, imagePath);
        }
        return image;
    }
}
