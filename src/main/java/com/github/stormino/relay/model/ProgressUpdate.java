package com.github.stormino.relay.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class ProgressUpdate {

    private String taskId;
    private Integer slotId;
    private TransferStatus status;
    private Double progress;
    private Long bytesTransferred;
    private Long totalBytes;
    private Integer chunkSize;
    private String throughput;  // Human readable: "5.2 MiB/s"
    private String remoteId;
    private String message;
    private String errorMessage;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    public static ProgressUpdate forProgress(String taskId, TransferProgress progress, String throughput) {
        return ProgressUpdate.builder()
                .taskId(taskId)
                .status(TransferStatus.DOWNLOADING)
                .progress(progress.getPercentage())
                .bytesTransferred(progress.getBytesTransferred())
                .totalBytes(progress.getTotalBytes() > 0 ? progress.getTotalBytes() : null)
                .chunkSize(progress.getCurrentChunkSize())
                .throughput(throughput)
                .build();
    }

    public static ProgressUpdate forOutcome(TransferTask task, int slotId, TransferResult result) {
        return ProgressUpdate.builder()
                .taskId(task.getId())
                .slotId(slotId)
                .status(result.toTransferStatus())
                .progress(result.isSuccess() ? 100.0 : null)
                .bytesTransferred(result.getBytesTransferred())
                .remoteId(result.getRemoteId())
                .errorMessage(result.getErrorMessage())
                .build();
    }

    public static ProgressUpdate forStatus(String taskId, TransferStatus status, String message) {
        return ProgressUpdate.builder()
                .taskId(taskId)
                .status(status)
                .message(message)
                .build();
    }
}
