package com.campaignkeeper.repository;

/**
 * Hand-written save documents used across the repository tests.
 */
final class SaveFixtures {

    static final String LOST_MINES = """
        # Metadata
        ---
        version: 1
        campaign: Lost Mines
        created: '2026-03-01T18:00:00Z'
        last_played: '2026-03-02T20:30:00Z'
        dm: Alex
        ---

        # World State
        ---
        Synopsis: Goblins stir near Phandalin.
        ## NPCs
        - **Sildar Hallwinter**: a knight of the Lords' Alliance [tags: ally, human]
        ## Locations
        - **Phandalin**: frontier town
        ## Items
        ## Factions
        - Redbrands
        ---

        # Story Plan
        ---
        1. [done] Reach Phandalin
        2. [active] Clear the hideout
        3. Find Wave Echo Cave
        ---

        # Scene History
        ---
        <details>
        <summary>2026-03-01 – "Goblin Ambush"</summary>

        **Scene**: scene-0001
        **Started**: 2026-03-01T18:05:00Z
        **Ended**: 2026-03-01T19:00:00Z
        **Covers**: 1-24
        **Summarized**: 2026-03-01T19:00:00Z
        **Forced**: false
        **Transcript**: [[transcripts/lost-mines/scene-0001.json]]
        **Summary**: The party fought goblins on the Triboar Trail.
        They found the horses of Gundren dead.

        </details>
        ---

        # Open Threads
        ---
        - [ ] Where is Gundren? _(opened 2026-03-01T18:00:00Z)_
        - [x] Who leads the goblins? _(opened 2026-03-01T18:30:00Z)_
        - Legacy thread without a box
        ---

        # House Rules
        Critical hits double the dice.
        """;

    static final String EMPTY = """
        # Metadata
        ---
        version: 1
        campaign: Empty
        created: '2026-03-01T18:00:00Z'
        ---

        # World State
        ---
        ---

        # Story Plan
        ---
        ---

        # Scene History
        ---
        ---

        # Open Threads
        ---
        ---
        """;

    private SaveFixtures() {
    }
}
