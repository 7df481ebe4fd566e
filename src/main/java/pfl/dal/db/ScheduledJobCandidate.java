package pfl.dal.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pending scheduled job as seen by the job linker
 * @since 15/01/2026
 */
public record ScheduledJobCandidate(long id, String printerId, String itemName, String modelName,
                                    String filename, Integer layerCount) {

    /**
     * Non-blank names the observed file name is compared against
     */
    public List<String> candidateNames() {
        List<String> names = new ArrayList<>(3);
        for (String name : new String[]{itemName, modelName, filename}) {
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        return Collections.unmodifiableList(names);
    }

    public boolean hasLayerCount(int layers) {
        return layerCount != null && layerCount > 0 && layerCount == layers;
    }
}
