package pfl.domain.printer;

import pfl.common.EJobOutcome;
import pfl.common.EPrinterState;

/**
 * Protocol-agnostic snapshot of one printer. Instances are immutable and replaced as a whole,
 * so a reader never sees a half-updated status.
 * @since 12/01/2026
 */
public final class CanonicalStatus {
    private final String printerId;
    private final EPrinterState state;
    private final EJobOutcome jobOutcome;
    private final double progressPercent;
    private final int currentLayer;
    private final int totalLayers;
    private final double bedTemp;
    private final double bedTarget;
    private final double nozzleTemp;
    private final double nozzleTarget;
    private final int timeRemainingSeconds;
    private final String filename;
    private final String errorCode;
    private final String errorMessage;
    private final String lastError;
    private final String rawPayload;
    private final long lastUpdate;

    private CanonicalStatus(Builder builder) {
        this.printerId = builder.printerId;
        this.state = builder.state == null ? EPrinterState.UNKNOWN : builder.state;
        this.jobOutcome = builder.jobOutcome == null ? EJobOutcome.NONE : builder.jobOutcome;
        this.progressPercent = Math.max(0.0, Math.min(100.0, builder.progressPercent));
        this.currentLayer = Math.max(0, builder.currentLayer);
        this.totalLayers = Math.max(0, builder.totalLayers);
        this.bedTemp = builder.bedTemp;
        this.bedTarget = builder.bedTarget;
        this.nozzleTemp = builder.nozzleTemp;
        this.nozzleTarget = builder.nozzleTarget;
        this.timeRemainingSeconds = Math.max(0, builder.timeRemainingSeconds);
        this.filename = builder.filename;
        this.errorCode = builder.errorCode;
        this.errorMessage = builder.errorMessage;
        this.lastError = builder.lastError;
        this.rawPayload = builder.rawPayload;
        this.lastUpdate = builder.lastUpdate;
    }

    /**
     * Status of a printer that is not reachable. Keeps the printer visible with the reason.
     */
    public static CanonicalStatus offline(String printerId, String lastError) {
        return builder(printerId).state(EPrinterState.OFFLINE).lastError(lastError).build();
    }

    public static CanonicalStatus unknown(String printerId) {
        return builder(printerId).state(EPrinterState.UNKNOWN).build();
    }

    public static Builder builder(String printerId) {
        return new Builder(printerId);
    }

    public Builder toBuilder() {
        return new Builder(printerId)
                .state(state)
                .jobOutcome(jobOutcome)
                .progressPercent(progressPercent)
                .currentLayer(currentLayer)
                .totalLayers(totalLayers)
                .bedTemp(bedTemp)
                .bedTarget(bedTarget)
                .nozzleTemp(nozzleTemp)
                .nozzleTarget(nozzleTarget)
                .timeRemainingSeconds(timeRemainingSeconds)
                .filename(filename)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .lastError(lastError)
                .rawPayload(rawPayload)
                .lastUpdate(lastUpdate);
    }

    /**
     * Same telemetry, marked offline. Used when the transport dropped or went silent.
     */
    public CanonicalStatus asOffline(String reason) {
        return toBuilder().state(EPrinterState.OFFLINE).lastError(reason).lastUpdate(System.currentTimeMillis()).build();
    }

    public String getPrinterId() {
        return printerId;
    }

    public EPrinterState getState() {
        return state;
    }

    public EJobOutcome getJobOutcome() {
        return jobOutcome;
    }

    public double getProgressPercent() {
        return progressPercent;
    }

    public int getCurrentLayer() {
        return currentLayer;
    }

    public int getTotalLayers() {
        return totalLayers;
    }

    public double getBedTemp() {
        return bedTemp;
    }

    public double getBedTarget() {
        return bedTarget;
    }

    public double getNozzleTemp() {
        return nozzleTemp;
    }

    public double getNozzleTarget() {
        return nozzleTarget;
    }

    public int getTimeRemainingSeconds() {
        return timeRemainingSeconds;
    }

    /**
     * @return file or job name reported by the device, null when unknown
     */
    public String getFilename() {
        return filename;
    }

    /**
     * @return active device error code, null when the device reports no error
     */
    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean hasError() {
        return errorCode != null && !errorCode.isEmpty();
    }

    /**
     * @return last transport or connection error, kept for display while OFFLINE
     */
    public String getLastError() {
        return lastError;
    }

    public String getRawPayload() {
        return rawPayload;
    }

    public long getLastUpdate() {
        return lastUpdate;
    }

    @Override
    public String toString() {
        return String.format("CanonicalStatus{printer=%s, state=%s, outcome=%s, progress=%.1f, layer=%d/%d, bed=%.1f/%.1f, nozzle=%.1f/%.1f, file='%s', error=%s}",
                printerId, state, jobOutcome, progressPercent, currentLayer, totalLayers,
                bedTemp, bedTarget, nozzleTemp, nozzleTarget, filename, errorCode);
    }

    public static final class Builder {
        private final String printerId;
        private EPrinterState state = EPrinterState.OFFLINE;
        private EJobOutcome jobOutcome = EJobOutcome.NONE;
        private double progressPercent;
        private int currentLayer;
        private int totalLayers;
        private double bedTemp;
        private double bedTarget;
        private double nozzleTemp;
        private double nozzleTarget;
        private int timeRemainingSeconds;
        private String filename;
        private String errorCode;
        private String errorMessage;
        private String lastError;
        private String rawPayload;
        private long lastUpdate = System.currentTimeMillis();

        private Builder(String printerId) {
            this.printerId = printerId;
        }

        public Builder state(EPrinterState state) {
            this.state = state;
            return this;
        }

        public Builder jobOutcome(EJobOutcome jobOutcome) {
            this.jobOutcome = jobOutcome;
            return this;
        }

        public Builder progressPercent(double progressPercent) {
            this.progressPercent = progressPercent;
            return this;
        }

        public Builder currentLayer(int currentLayer) {
            this.currentLayer = currentLayer;
            return this;
        }

        public Builder totalLayers(int totalLayers) {
            this.totalLayers = totalLayers;
            return this;
        }

        public Builder bedTemp(double bedTemp) {
            this.bedTemp = bedTemp;
            return this;
        }

        public Builder bedTarget(double bedTarget) {
            this.bedTarget = bedTarget;
            return this;
        }

        public Builder nozzleTemp(double nozzleTemp) {
            this.nozzleTemp = nozzleTemp;
            return this;
        }

        public Builder nozzleTarget(double nozzleTarget) {
            this.nozzleTarget = nozzleTarget;
            return this;
        }

        public Builder timeRemainingSeconds(int timeRemainingSeconds) {
            this.timeRemainingSeconds = timeRemainingSeconds;
            return this;
        }

        public Builder filename(String filename) {
            this.filename = filename == null || filename.isBlank() ? null : filename;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode == null || errorCode.isBlank() ? null : errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder rawPayload(String rawPayload) {
            this.rawPayload = rawPayload;
            return this;
        }

        public Builder lastUpdate(long lastUpdate) {
            this.lastUpdate = lastUpdate;
            return this;
        }

        public CanonicalStatus build() {
            return new CanonicalStatus(this);
        }
    }
}
