package org.janelia.colorcast.session;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.DoubleFunction;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.janelia.colorcast.config.Config;
import org.janelia.colorcast.image.ColorImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces rapid intensity changes, such as the ones coming from a slider, so that only the last
 * requested intensity within the quiet window is blended.
 */
public class DebouncedBlendScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DebouncedBlendScheduler.class);

    public static final int DEFAULT_DEBOUNCE_MILLIS = 50;

    private final DoubleFunction<ColorImage> blendFunction;
    private final Consumer<ColorImage> resultConsumer;
    private final long debounceMillis;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pendingBlend;

    /**
     * @param session session that performs the blend
     * @param resultConsumer receives every blended image on the scheduler thread
     * @param debounceMillis quiet window in milliseconds
     */
    public DebouncedBlendScheduler(ColorTransferSession session, Consumer<ColorImage> resultConsumer, long debounceMillis) {
        this(intensity -> {
            synchronized (session) {
                session.setIntensity(intensity);
                return session.applyTransfer();
            }
        }, resultConsumer, debounceMillis);
    }

    /**
     * Create a scheduler whose quiet window is read from the "Blend.DebounceMillis" setting.
     */
    public static DebouncedBlendScheduler fromConfig(ColorTransferSession session, Consumer<ColorImage> resultConsumer, Config config) {
        int debounceMillis = config.getIntegerPropertyValue("Blend.DebounceMillis", DEFAULT_DEBOUNCE_MILLIS);
        return new DebouncedBlendScheduler(session, resultConsumer, debounceMillis);
    }

    DebouncedBlendScheduler(DoubleFunction<ColorImage> blendFunction, Consumer<ColorImage> resultConsumer, long debounceMillis) {
        Preconditions.checkArgument(debounceMillis >= 0, "Debounce window cannot be negative: %s", debounceMillis);
        this.blendFunction = blendFunction;
        this.resultConsumer = resultConsumer;
        this.debounceMillis = debounceMillis;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("CCBLEND-%d")
                        .setDaemon(true)
                        .build());
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    /**
     * Schedule a blend with the given intensity and cancel the one that is still waiting, if any.
     */
    public synchronized void requestBlend(double intensity) {
        Preconditions.checkState(!scheduler.isShutdown(), "Blend scheduler is closed");
        if (pendingBlend != null && !pendingBlend.isDone()) {
            pendingBlend.cancel(false);
            LOG.trace("Superseded pending blend with intensity {}", intensity);
        }
        pendingBlend = scheduler.schedule(() -> runBlend(intensity), debounceMillis, TimeUnit.MILLISECONDS);
    }

    private void runBlend(double intensity) {
        long startTime = System.currentTimeMillis();
        try {
            ColorImage blended = blendFunction.apply(intensity);
            LOG.debug("Blended with intensity {} in {}ms", intensity, System.currentTimeMillis() - startTime);
            if (blended != null) {
                resultConsumer.accept(blended);
            }
        } catch (Exception e) {
            LOG.error("Error blending with intensity {}", intensity, e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
