package quest.gekko.insights.domain;

public enum AcquisitionSource {
    LIVE,
    SYNTHETIC
}
