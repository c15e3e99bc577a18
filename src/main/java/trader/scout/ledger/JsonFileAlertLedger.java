package trader.scout.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import trader.scout.config.ScoutProperties;
import trader.scout.exception.LedgerReadException;
import trader.scout.exception.LedgerWriteException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ledger kept as a JSON array of strings in a single file.
 * Writes go to a sibling temp file that is then moved over the target.
 */
@Slf4j
@Repository
public class JsonFileAlertLedger implements AlertLedger {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path file;

    @Autowired
    public JsonFileAlertLedger(ObjectMapper objectMapper, ScoutProperties properties) {
        this(objectMapper, Paths.get(properties.getLedgerFile()));
    }

    public JsonFileAlertLedger(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper;
        this.file = file.toAbsolutePath();
    }

    @Override
    public Set<String> load() {
        if (!Files.exists(file)) {
            log.debug("No ledger at {}, starting empty", file);
            return new HashSet<>();
        }
        try {
            List<String> identifiers = objectMapper.readValue(file.toFile(), STRING_LIST);
            if (identifiers == null) {
                throw new LedgerReadException("Ledger " + file + " holds null instead of an array", null);
            }
            Set<String> result = new HashSet<>(identifiers);
            result.remove(null);
            log.debug("Loaded {} alerted coins from {}", result.size(), file);
            return result;
        } catch (IOException e) {
            throw new LedgerReadException("Failed to read ledger " + file, e);
        }
    }

    @Override
    public void save(Set<String> identifiers) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // Sorted so the file diffs cleanly between cycles
            objectMapper.writeValue(tmp.toFile(), new TreeSet<>(identifiers));
            moveIntoPlace(tmp);
            log.debug("Saved {} alerted coins to {}", identifiers.size(), file);
        } catch (IOException e) {
            throw new LedgerWriteException("Failed to write ledger " + file, e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
