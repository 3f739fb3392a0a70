package com.jetlang.h3.server;

import java.util.HashSet;
import java.util.Set;

/**
 * Stream ids that must never get a new handler. Ids of each of the four stream types rise by 4, so every type
 * keeps a floor below which all of its ids are retired. Only ids retired out of order are held individually.
 */
class RetiredStreams {

    private final long[] floors = {0, 1, 2, 3};
    private final Set<Long> aboveFloor = new HashSet<>();

    void retire(long streamId) {
        final int type = (int) (streamId & 0x3);
        if (streamId < floors[type]) {
            return;
        }
        aboveFloor.add(streamId);
        while (aboveFloor.remove(floors[type])) {
            floors[type] += 4;
        }
    }

    boolean isRetired(long streamId) {
        return streamId < floors[(int) (streamId & 0x3)] || aboveFloor.contains(streamId);
    }

    /**
     * @return ids held individually, the ones retired ahead of a lower id of the same type.
     */
    int pending() {
        return aboveFloor.size();
    }
}
