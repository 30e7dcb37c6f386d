package im.arun.hoteltree.sync;

import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.HotelSummary;
import im.arun.hoteltree.model.HotelTemplate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Local persistent copy of hotel trees used while the remote store is unreachable. Each tree is
 * kept as one record; a separate index record lists the known hotels and one more holds all
 * templates.
 */
public interface LocalCache {

    Optional<ContentNode> loadTree(String hotelId);

    void saveTree(String hotelId, ContentNode root);

    List<HotelSummary> listSummaries();

    void saveSummaries(List<HotelSummary> summaries);

    List<HotelTemplate> listTemplates();

    void saveTemplates(List<HotelTemplate> templates);

    /**
     * Adds the hotel to the index, or renames it when its name changed. An unchanged name leaves
     * the index untouched.
     */
    default void upsertSummary(String hotelId, String name) {
        List<HotelSummary> summaries = listSummaries();
        HotelSummary updated = HotelSummary.of(hotelId, name);
        for (HotelSummary summary : summaries) {
            if (summary.getId().equals(hotelId)) {
                if (!Objects.equals(summary.getName(), updated.getName())) {
                    summary.setName(updated.getName());
                    saveSummaries(summaries);
                }
                return;
            }
        }
        summaries.add(updated);
        saveSummaries(summaries);
    }
}
