package io.coordhub.util;

import java.util.UUID;

public final class Ids {
    private Ids() {
    }

    public static String taskId() {
        return "tsk_" + UUID.randomUUID();
    }

    public static String claimId() {
        return "clm_" + UUID.randomUUID();
    }

    public static String relationId() {
        return "rel_" + UUID.randomUUID();
    }
}
