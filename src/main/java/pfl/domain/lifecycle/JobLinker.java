package pfl.domain.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.dal.db.RepositoryException;
import pfl.dal.db.ScheduledJobCandidate;

import javax.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Matches an observed print start to pending scheduled work.
 * <ol>
 *     <li>name: normalized observed name contained in a candidate name or the other way round</li>
 *     <li>layer count: only when exactly one candidate has the observed layer count</li>
 * </ol>
 * Anything ambiguous stays unlinked.
 *
 * @since 15/01/2026
 */
public class JobLinker {
    private static final Logger logger = LoggerFactory.getLogger(JobLinker.class);

    private static final String[] FILE_EXTENSIONS = {".3mf", ".gcode", ".bgcode", ".gco", ".g", ".ufp", ".ctb", ".goo"};

    private final IScheduleProvider scheduleProvider;

    @Inject
    public JobLinker(IScheduleProvider scheduleProvider) {
        this.scheduleProvider = scheduleProvider;
    }

    public Optional<JobLink> link(String printerId, String observedName, int totalLayers) {
        List<ScheduledJobCandidate> candidates;
        try {
            candidates = scheduleProvider.findPendingCandidates(printerId);
        } catch (RepositoryException e) {
            logger.warn("[{}] Cannot load scheduled jobs, print stays unlinked: {}", printerId, e.getMessage());
            return Optional.empty();
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Optional<JobLink> byName = matchByName(observedName, candidates);
        if (byName.isPresent()) {
            logger.info("[{}] Linked '{}' to scheduled job {} by name ('{}')",
                    printerId, observedName, byName.get().scheduledJobId(), byName.get().matchedName());
            return byName;
        }

        if (totalLayers <= 0) {
            logger.info("[{}] No name match for '{}' and layer count unknown, print stays unlinked", printerId, observedName);
            return Optional.empty();
        }

        List<ScheduledJobCandidate> layerMatches = new ArrayList<>();
        for (ScheduledJobCandidate candidate : candidates) {
            if (candidate.hasLayerCount(totalLayers)) {
                layerMatches.add(candidate);
            }
        }
        if (layerMatches.size() == 1) {
            ScheduledJobCandidate match = layerMatches.get(0);
            logger.info("[{}] Linked '{}' to scheduled job {} by layer count ({})", printerId, observedName, match.id(), totalLayers);
            return Optional.of(new JobLink(match.id(), JobLink.EMatchStrategy.LAYER_COUNT, null));
        }
        if (layerMatches.size() > 1) {
            logger.info("[{}] {} scheduled jobs have {} layers, print stays unlinked", printerId, layerMatches.size(), totalLayers);
        } else {
            logger.info("[{}] No scheduled job matches '{}' ({} layers), ad-hoc print", printerId, observedName, totalLayers);
        }
        return Optional.empty();
    }

    private static Optional<JobLink> matchByName(String observedName, List<ScheduledJobCandidate> candidates) {
        String observed = normalize(observedName);
        if (observed.isEmpty()) {
            return Optional.empty();
        }
        for (ScheduledJobCandidate candidate : candidates) {
            for (String name : candidate.candidateNames()) {
                String target = normalize(name);
                if (!target.isEmpty() && (target.contains(observed) || observed.contains(target))) {
                    return Optional.of(new JobLink(candidate.id(), JobLink.EMatchStrategy.NAME, name));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Lower case, no directory, no slicer file extensions ({@code "/cache/Benchy.gcode.3mf" -> "benchy"})
     */
    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String result = name.trim().toLowerCase(Locale.ROOT);
        int slash = Math.max(result.lastIndexOf('/'), result.lastIndexOf('\\'));
        if (slash >= 0) {
            result = result.substring(slash + 1);
        }
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String extension : FILE_EXTENSIONS) {
                if (result.endsWith(extension) && result.length() > extension.length()) {
                    result = result.substring(0, result.length() - extension.length());
                    stripped = true;
                }
            }
        }
        return result.trim();
    }
}
