package com.campaignkeeper.memory;

import com.campaignkeeper.config.MemoryConfig;
import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.model.Summary;
import com.campaignkeeper.model.Turn;
import com.campaignkeeper.model.TurnRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides when a history buffer's prefix is folded into a rolling summary, and produces it.
 *
 * <p>Compression runs only when the buffer is over budget <em>and</em> a natural break has been
 * detected, so a reply is never cut mid-exchange. Past the hard ceiling compression is forced
 * without a break, leaving the most recent turns verbatim, and the summary is flagged.</p>
 */
public class Compressor {

    private static final Logger log = LoggerFactory.getLogger(Compressor.class);

    private final Summarizer summarizer;
    private final MemoryConfig config;
    private final BreakDetector breakDetector;
    private final Clock clock;

    public Compressor(Summarizer summarizer, MemoryConfig config, Clock clock) {
        this.summarizer = summarizer;
        this.config = config;
        this.breakDetector = new BreakDetector(config.idleTurnThreshold(), config.encounterEndMarkers());
        this.clock = clock;
    }

    public MemoryConfig getConfig() {
        return config;
    }

    /**
     * Checks the trigger policy after a turn was appended and compresses when it fires.
     *
     * @param knownNames names already established (e.g. world state entities), lower or mixed case
     * @throws CampaignException with {@link CampaignErrorCode#COMPRESSION_FAILED}; buffer unchanged
     */
    public CompressionOutcome onTurnAppended(HistoryBuffer buffer, Set<String> knownNames) {
        int cost = buffer.size();
        if (cost <= config.contextBudgetTokens()) {
            return CompressionOutcome.withinBudget(cost);
        }

        Optional<BreakReason> naturalBreak = awaitingReply(buffer)
            ? Optional.empty()
            : breakDetector.detect(buffer, knownNames);
        if (naturalBreak.isPresent()) {
            Summary summary = compress(buffer, buffer.turnCount(), false);
            log.info("Compressed {} at {} break: {} -> {} tokens",
                buffer.getOwnerId(), naturalBreak.get(), cost, buffer.size());
            return new CompressionOutcome(CompressionOutcome.Status.COMPRESSED, naturalBreak.get(), summary,
                cost, buffer.size());
        }

        if (cost > config.hardCeilingTokens()) {
            int through = exchangeStart(buffer.snapshot(), buffer.turnCount() - config.keepRecentTurns());
            if (through > buffer.compactedCount()) {
                Summary summary = compress(buffer, through, true);
                log.warn("Hard ceiling crossed for {} ({} > {} tokens); compressed without a narrative break",
                    buffer.getOwnerId(), cost, config.hardCeilingTokens());
                return new CompressionOutcome(CompressionOutcome.Status.FORCED, null, summary, cost, buffer.size());
            }
        }

        log.debug("{} over budget ({} > {}), waiting for a break", buffer.getOwnerId(), cost,
            config.contextBudgetTokens());
        return CompressionOutcome.deferred(cost);
    }

    // moves a forced cut back so a reply is never kept without its player prompt
    private static int exchangeStart(List<Turn> turns, int through) {
        if (through > 0 && through < turns.size() && turns.get(through).role() != TurnRole.PLAYER
            && turns.get(through - 1).role() == TurnRole.PLAYER) {
            return through - 1;
        }
        return through;
    }

    // a player turn still waiting for its reply is never a break point
    private static boolean awaitingReply(HistoryBuffer buffer) {
        return buffer.lastTurn().map(turn -> turn.role() == TurnRole.PLAYER).orElse(false);
    }

    /**
     * Produces the summary of a concluding scene, covering every turn in the buffer.
     * The budget is ignored: conclusion is always a break.
     *
     * @param fallbackText used when the buffer holds no turns at all
     */
    public Summary compressForConclusion(HistoryBuffer buffer, String fallbackText) {
        if (buffer.isEmpty()) {
            Summary summary = new Summary(buffer.getOwnerId(), 0, 0, fallbackText, clock.instant(), false);
            buffer.recordSummary(summary);
            return summary;
        }
        if (buffer.compactedCount() == buffer.turnCount()) {
            Summary latest = buffer.latestSummary().orElseThrow();
            if (!latest.forced()) {
                return latest;
            }
            Summary summary = new Summary(latest.sceneId(), 1, buffer.turnCount(), latest.text(),
                clock.instant(), false);
            buffer.recordSummary(summary);
            return summary;
        }
        return compress(buffer, buffer.turnCount(), false);
    }

    private Summary compress(HistoryBuffer buffer, int throughCount, boolean forced) {
        List<Turn> toCompact = buffer.snapshot().subList(buffer.compactedCount(), throughCount);
        String previous = buffer.latestSummary().map(Summary::text).orElse(null);

        String text;
        try {
            text = summarizer.summarize(previous, toCompact, config.summaryMaxChars());
        } catch (CampaignException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CampaignException(CampaignErrorCode.COMPRESSION_FAILED,
                "Summarizer failed for " + buffer.getOwnerId() + ": " + e.getMessage(), e);
        }
        if (text == null || text.isBlank()) {
            throw new CampaignException(CampaignErrorCode.COMPRESSION_FAILED,
                "Summarizer returned an empty summary for " + buffer.getOwnerId());
        }

        String sceneId = toCompact.isEmpty() || toCompact.get(0).sceneId() == null
            ? buffer.getOwnerId() : toCompact.get(0).sceneId();
        Summary summary = new Summary(sceneId, 1, throughCount, clip(text, config.summaryMaxChars()),
            clock.instant(), forced);
        buffer.compact(throughCount, summary);
        return summary;
    }

    /**
     * Shortens text to at most {@code maxChars}, preferring a sentence end, then a word boundary.
     */
    static String clip(String text, int maxChars) {
        String stripped = text.strip();
        if (stripped.length() <= maxChars) {
            return stripped;
        }
        String cut = stripped.substring(0, maxChars);
        int sentenceEnd = Math.max(cut.lastIndexOf(". "), Math.max(cut.lastIndexOf("! "), cut.lastIndexOf("? ")));
        if (sentenceEnd >= maxChars / 2) {
            return cut.substring(0, sentenceEnd + 1);
        }
        int space = cut.lastIndexOf(' ');
        if (space >= maxChars / 2) {
            return cut.substring(0, space);
        }
        return cut;
    }
}
