package com.lipid.advisor.evidence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only table of guideline and reimbursement citations, keyed by evidence id.
 * Loaded once at startup and shared freely between threads.
 */
public final class EvidenceTable {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceTable.class);

    public static final String DEFAULT_RESOURCE = "/evidence/lipid-evidence.json";

    private final Map<String, EvidenceReference> referencesById;

    private EvidenceTable(Map<String, EvidenceReference> referencesById) {
        this.referencesById = Collections.unmodifiableMap(referencesById);
    }

    /**
     * Build a table from references; ids must be unique
     * @param references The references, in display order
     * @return Immutable table
     */
    public static EvidenceTable of(Collection<EvidenceReference> references) {
        Map<String, EvidenceReference> byId = new LinkedHashMap<>();
        for (EvidenceReference reference : references) {
            if (byId.putIfAbsent(reference.getId(), reference) != null) {
                throw new EvidenceLoadException("Duplicate evidence id: " + reference.getId());
            }
        }
        return new EvidenceTable(byId);
    }

    /**
     * Load the bundled evidence table from the classpath
     * @return Immutable table
     */
    public static EvidenceTable loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load an evidence table from a classpath JSON resource
     * @param resource Absolute classpath resource name
     * @return Immutable table
     */
    public static EvidenceTable load(String resource) {
        try (InputStream in = EvidenceTable.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new EvidenceLoadException("Evidence resource not found: " + resource);
            }
            EvidenceTable table = parse(in);
            logger.info("Loaded {} evidence references from {}", table.size(), resource);
            return table;
        } catch (IOException e) {
            throw new EvidenceLoadException("Failed to read evidence resource " + resource, e);
        }
    }

    static EvidenceTable parse(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            List<EvidenceReference> references = mapper.readValue(in, new TypeReference<List<EvidenceReference>>() { });
            return of(references);
        } catch (JsonProcessingException e) {
            throw new EvidenceLoadException("Malformed evidence table: " + e.getMessage(), e);
        }
    }

    /**
     * Verify that the table can resolve every id the decision logic emits
     * @param ids Required evidence ids
     * @throws EvidenceLoadException naming the missing ids
     */
    public void requireAll(Collection<String> ids) {
        List<String> missing = ids.stream()
                .filter(id -> !referencesById.containsKey(id))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new EvidenceLoadException("Evidence table is missing ids: " + missing);
        }
    }

    public Optional<EvidenceReference> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(referencesById.get(id));
    }

    public boolean contains(String id) {
        return id != null && referencesById.containsKey(id);
    }

    public List<EvidenceReference> byCategory(EvidenceCategory category) {
        return referencesById.values().stream()
                .filter(reference -> reference.getCategory() == category)
                .collect(Collectors.toList());
    }

    public Collection<EvidenceReference> all() {
        return referencesById.values();
    }

    public int size() {
        return referencesById.size();
    }
}
