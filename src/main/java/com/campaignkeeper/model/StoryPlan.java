package com.campaignkeeper.model;

import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered narrative beats. Orders are 1..n without gaps and at most one beat is active.
 */
public class StoryPlan {

    private final List<StoryBeat> beats = new ArrayList<>();

    public StoryPlan() {
    }

    /**
     * Rebuilds a plan from stored beats, checking the ordering and single-active invariants.
     *
     * @throws IllegalArgumentException if the beats violate an invariant
     */
    public static StoryPlan restore(List<StoryBeat> stored) {
        StoryPlan plan = new StoryPlan();
        int active = 0;
        for (int i = 0; i < stored.size(); i++) {
            StoryBeat beat = stored.get(i);
            if (beat.order() != i + 1) {
                throw new IllegalArgumentException("Beat orders must be contiguous from 1, found " + beat.order()
                    + " at position " + (i + 1));
            }
            if (beat.status() == BeatStatus.ACTIVE) {
                active++;
            }
            plan.beats.add(beat);
        }
        if (active > 1) {
            throw new IllegalArgumentException("At most one beat may be active, found " + active);
        }
        return plan;
    }

    public StoryBeat addBeat(String description) {
        StoryBeat beat = new StoryBeat(beats.size() + 1, description, BeatStatus.PENDING);
        beats.add(beat);
        return beat;
    }

    /**
     * Applies a status transition. Allowed moves are pending to active (when no other beat is
     * active), pending to done and active to done. The plan is unchanged when the move is refused.
     */
    public StoryBeat apply(BeatTransition transition) {
        int index = transition.order() - 1;
        if (index < 0 || index >= beats.size()) {
            throw new CampaignException(CampaignErrorCode.INVALID_BEAT_TRANSITION,
                "No story beat with order " + transition.order());
        }
        StoryBeat current = beats.get(index);
        BeatStatus from = current.status();
        BeatStatus to = transition.target();
        boolean allowed = switch (from) {
            case PENDING -> to == BeatStatus.ACTIVE || to == BeatStatus.DONE;
            case ACTIVE -> to == BeatStatus.DONE;
            case DONE -> false;
        };
        if (!allowed) {
            throw new CampaignException(CampaignErrorCode.INVALID_BEAT_TRANSITION,
                "Beat " + current.order() + " cannot move from " + from.label() + " to " + to.label());
        }
        if (to == BeatStatus.ACTIVE) {
            Optional<StoryBeat> active = activeBeat();
            if (active.isPresent()) {
                throw new CampaignException(CampaignErrorCode.INVALID_BEAT_TRANSITION,
                    "Beat " + active.get().order() + " is already active");
            }
        }
        StoryBeat updated = current.withStatus(to);
        beats.set(index, updated);
        return updated;
    }

    public Optional<StoryBeat> activeBeat() {
        return beats.stream().filter(beat -> beat.status() == BeatStatus.ACTIVE).findFirst();
    }

    public List<StoryBeat> beats() {
        return Collections.unmodifiableList(beats);
    }

    public int size() {
        return beats.size();
    }

    public String outline(int maxBeats) {
        List<String> parts = new ArrayList<>();
        for (StoryBeat beat : beats) {
            if (parts.size() == maxBeats) {
                break;
            }
            parts.add(beat.order() + ". [" + beat.status().label() + "] " + beat.description());
        }
        return String.join(" -> ", parts);
    }

    public StoryPlan copy() {
        StoryPlan copy = new StoryPlan();
        copy.beats.addAll(beats);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof StoryPlan other && beats.equals(other.beats));
    }

    @Override
    public int hashCode() {
        return beats.hashCode();
    }
}
