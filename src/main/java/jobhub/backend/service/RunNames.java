package jobhub.backend.service;

import jobhub.backend.storage.Keys;
import jobhub.backend.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

/**
 * Allocates human-readable run names like {@code brave-otter-3}.
 * A name is claimed with {@code putIfAbsent} on {@code run-names/<repoId>/<runName>},
 * so it is never handed out twice.
 */
public class RunNames {

    private static final Logger log = LoggerFactory.getLogger(RunNames.class);
    private static final int MAX_SUFFIX = 1000;

    private static final List<String> ADJECTIVES = List.of(
            "able", "bold", "brave", "bright", "calm", "clever", "cool", "eager", "fancy", "fast",
            "gentle", "glad", "good", "happy", "keen", "kind", "lucky", "mighty", "nice", "proud",
            "quick", "quiet", "rare", "sharp", "shy", "smart", "swift", "tidy", "warm", "wise");

    private static final List<String> ANIMALS = List.of(
            "ape", "badger", "bear", "beaver", "bison", "cat", "cobra", "crab", "crane", "deer",
            "dog", "eagle", "eel", "falcon", "fox", "frog", "goat", "hawk", "horse", "lion",
            "lynx", "mole", "moose", "newt", "otter", "owl", "panda", "seal", "swan", "wolf");

    private final ObjectStore store;
    private final Random random;

    public RunNames(ObjectStore store, Random random) {
        this.store = store;
        this.random = random;
    }

    public String createRun(String repoId) {
        while (true) {
            String base = ADJECTIVES.get(random.nextInt(ADJECTIVES.size()))
                    + "-" + ANIMALS.get(random.nextInt(ANIMALS.size()));
            for (int n = 1; n <= MAX_SUFFIX; n++) {
                String runName = base + "-" + n;
                if (store.putIfAbsent(Keys.runName(repoId, runName), runName.getBytes(StandardCharsets.UTF_8))) {
                    log.debug("Allocated run name {} in repo {}", runName, repoId);
                    return runName;
                }
            }
            log.debug("All suffixes of {} taken in repo {}", base, repoId);
        }
    }
}
