package quest.gekko.insights.service.acquisition;

public enum AcquisitionState {
    REQUESTED,
    ACQUIRING,
    ACQUIRED_LIVE,
    ACQUIRED_SYNTHETIC,
    PERSISTED,
    FAILED
}
