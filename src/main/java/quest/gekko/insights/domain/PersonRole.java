package quest.gekko.insights.domain;

public enum PersonRole {
    FOLLOWER,
    EMPLOYEE
}
