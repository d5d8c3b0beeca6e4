package com.kaspaaio.core.catalog;

/**
 * Named groups of services that start together. Phases are applied in
 * ascending order on add and descending order on remove.
 */
public enum StartupPhase {
    INFRASTRUCTURE(1),
    DATABASES(2),
    INDEXERS(3),
    APPLICATIONS(4);

    private final int order;

    StartupPhase(int order) {
        this.order = order;
    }

    public int order() {
        return order;
    }

    public static StartupPhase forStartupOrder(int startupOrder) {
        if (startupOrder <= 1) return INFRASTRUCTURE;
        if (startupOrder == 2) return DATABASES;
        if (startupOrder == 3) return INDEXERS;
        return APPLICATIONS;
    }
}
