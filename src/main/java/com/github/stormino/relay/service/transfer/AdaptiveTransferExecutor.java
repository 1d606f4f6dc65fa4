package com.github.stormino.relay.service.transfer;

import com.github.stormino.relay.config.RelayProperties;
import com.github.stormino.relay.exception.SinkUploadException;
import com.github.stormino.relay.exception.SourceReadException;
import com.github.stormino.relay.exception.SourceUnavailableException;
import com.github.stormino.relay.exception.TransferCancelledException;
import com.github.stormino.relay.model.ObjectHandle;
import com.github.stormino.relay.model.ProgressUpdate;
import com.github.stormino.relay.model.TransferProgress;
import com.github.stormino.relay.model.TransferResult;
import com.github.stormino.relay.model.TransferStatus;
import com.github.stormino.relay.model.TransferTask;
import com.github.stormino.relay.service.ProgressBroadcastService;
import com.github.stormino.relay.service.sink.TransferSink;
import com.github.stormino.relay.service.source.TransferSource;
import com.github.stormino.relay.util.SizeFormat;
import com.github.stormino.relay.util.StagingArea;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Stages an object from the source with throughput-adaptive chunk reads, then hands the staged
 * file to the sink. The staging area is deleted before a result is returned, whatever the outcome.
 */
@Slf4j
@Service
public class AdaptiveTransferExecutor implements TransferExecutor {

    private final TransferSource source;
    private final TransferSink sink;
    private final RelayProperties.Transfer settings;
    private final ProgressBroadcastService progressBroadcastService;
    private final LongSupplier nanoClock;

    @Autowired
    public AdaptiveTransferExecutor(TransferSource source,
                                    TransferSink sink,
                                    RelayProperties properties,
                                    ProgressBroadcastService progressBroadcastService) {
        this(source, sink, properties, progressBroadcastService, System::nanoTime);
    }

    AdaptiveTransferExecutor(TransferSource source,
                             TransferSink sink,
                             RelayProperties properties,
                             ProgressBroadcastService progressBroadcastService,
                             LongSupplier nanoClock) {
        this.source = source;
        this.sink = sink;
        this.settings = properties.getTransfer();
        this.progressBroadcastService = progressBroadcastService;
        this.nanoClock = nanoClock;

        // Fail startup on bad chunk or threshold settings
        ChunkSizeController.fromProperties(settings);
    }

    @Override
    public TransferResult run(TransferTask task, CancellationToken cancellation, Consumer<TransferStatus> phaseListener) {
        String taskId = task.getId();
        try {
            cancellation.throwIfCancelled(taskId);
            ObjectHandle handle = source.resolve(task.getLocator());
            log.info("Resolved {} [{}]: {}", task.getDisplayName(), taskId, SizeFormat.formatBytes(handle.getSizeBytes()));

            try (StagingArea staging = StagingArea.create(Path.of(settings.getStagingPath()), taskId, task.getDisplayName())) {
                TransferProgress progress = stage(task, handle, staging, cancellation);

                cancellation.throwIfCancelled(taskId);
                phaseListener.accept(TransferStatus.UPLOADING);
                progressBroadcastService.broadcastProgress(ProgressUpdate.forStatus(taskId, TransferStatus.UPLOADING,
                        "Uploading " + SizeFormat.formatBytes(progress.getBytesTransferred())));

                String remoteId = sink.upload(staging.getFile(), task.getDisplayName());
                logFinalStatistics(task, progress);
                return TransferResult.success(remoteId, progress.getBytesTransferred());
            }
        } catch (TransferCancelledException e) {
            return TransferResult.cancelled(e.getMessage());
        } catch (SourceUnavailableException e) {
            log.warn("Source unavailable for {} [{}]: {}", task.getDisplayName(), taskId, e.getMessage());
            return TransferResult.failure(TransferResult.FailureReason.SOURCE_UNAVAILABLE, e.getMessage(), e);
        } catch (SourceReadException e) {
            log.warn("Read failed for {} [{}] at byte {}: {}", task.getDisplayName(), taskId, e.getPosition(), e.getMessage());
            return TransferResult.failure(TransferResult.FailureReason.SOURCE_READ_ERROR, e.getMessage(), e);
        } catch (SinkUploadException e) {
            log.warn("Upload failed for {} [{}], HTTP status {}: {}",
                    e.getDisplayName(), taskId, e.getHttpStatus() != null ? e.getHttpStatus() : "n/a", e.getMessage());
            return TransferResult.failure(TransferResult.FailureReason.SINK_UPLOAD_ERROR, e.getMessage(), e);
        } catch (IOException e) {
            log.warn("Staging failed for {} [{}]: {}", task.getDisplayName(), taskId, e.getMessage());
            return TransferResult.failure(TransferResult.FailureReason.STAGING_ERROR, e.getMessage(), e);
        }
    }

    private TransferProgress stage(TransferTask task, ObjectHandle handle, StagingArea staging,
                                   CancellationToken cancellation) throws IOException {
        ChunkSizeController chunks = ChunkSizeController.fromProperties(settings);
        long startedAt = nanoClock.getAsLong();
        chunks.start(startedAt);
        TransferProgress progress = new TransferProgress(handle.getSizeBytes(), chunks.getCurrentChunkSize(), startedAt);

        try (OutputStream out = staging.openOutput()) {
            while (true) {
                cancellation.throwIfCancelled(task.getId());

                if (handle.isSizeKnown() && handle.getRemainingBytes() == 0) {
                    break;
                }
                int request = handle.isSizeKnown()
                        ? (int) Math.min(chunks.getCurrentChunkSize(), handle.getRemainingBytes())
                        : chunks.getCurrentChunkSize();

                Optional<byte[]> chunk = source.readChunk(handle, request);
                if (chunk.isEmpty() || chunk.get().length == 0) {
                    if (handle.isSizeKnown()) {
                        throw new SourceReadException("Source ended after " + handle.getPosition() + " of "
                                + handle.getSizeBytes() + " bytes", handle.getLocator().toString(), handle.getPosition());
                    }
                    break;
                }

                byte[] data = chunk.get();
                out.write(data);
                progress.addBytes(data.length);

                chunks.record(data.length, nanoClock.getAsLong())
                        .ifPresent(sample -> onWindowClosed(task, progress, sample));
            }
        }
        log.debug("Staged {} for {} [{}]", SizeFormat.formatBytes(progress.getBytesTransferred()),
                task.getDisplayName(), task.getId());
        return progress;
    }

    private void onWindowClosed(TransferTask task, TransferProgress progress, ChunkSizeController.WindowSample sample) {
        progress.recordSample(sample.getBytesPerSecond());
        String throughput = SizeFormat.formatThroughput(sample.getBytesPerSecond());

        if (sample.isAdjusted()) {
            progress.setCurrentChunkSize(sample.getChunkSize());
            log.info("{} throughput {} for {} [{}], chunk size {} -> {}",
                    sample.getBand(), throughput, task.getDisplayName(), task.getId(),
                    SizeFormat.formatBytes(sample.getPreviousChunkSize()), SizeFormat.formatBytes(sample.getChunkSize()));
        } else {
            log.debug("{} throughput {} for {} [{}], chunk size stays {}",
                    sample.getBand(), throughput, task.getDisplayName(), task.getId(),
                    SizeFormat.formatBytes(sample.getChunkSize()));
        }

        progressBroadcastService.broadcastProgress(ProgressUpdate.forProgress(task.getId(), progress, throughput));
    }

    private void logFinalStatistics(TransferTask task, TransferProgress progress) {
        long now = nanoClock.getAsLong();
        double elapsedSeconds = (now - progress.getStartedAtNanos()) / 1_000_000_000.0;
        log.info("Transfer statistics for {} [{}]: {} in {}s, average {}, peak {}, final chunk size {}",
                task.getDisplayName(), task.getId(),
                SizeFormat.formatBytes(progress.getBytesTransferred()),
                String.format("%.1f", elapsedSeconds),
                SizeFormat.formatThroughput(progress.getAverageThroughput(now)),
                SizeFormat.formatThroughput(progress.getPeakThroughput()),
                SizeFormat.formatBytes(progress.getCurrentChunkSize()));
    }
}
