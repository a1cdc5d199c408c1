package com.pstrata.server.ai.family;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pstrata.server.ai.UnsupportedCombinationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only lookup from (family, link) to {@link FamilyLinkEntry}.
 *
 * <p>The process-wide instance is loaded once from {@code /family_links.json}. Loading
 * rejects rows naming an unknown family or link, a link inverse that disagrees with the
 * link, a family whose rows disagree on kernel or auxiliary parameter, and any pair
 * whose link inverse can leave the kernel's location domain.
 */
public class FamilyLinkRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FamilyLinkRegistry.class);

    public static final String RESOURCE = "/family_links.json";

    /**
     * One row of the persisted table.
     */
    public static class TableRow {
        public String family;
        public String link;
        public String kernel;
        public String linkInverse;
        public boolean hasAuxiliary;
        public String auxiliaryName;
        public String auxiliaryDomain;
    }

    private static final class Holder {
        private static final FamilyLinkRegistry INSTANCE = loadDefault();
    }

    private final Map<OutcomeFamily, Map<LinkFunction, FamilyLinkEntry>> entries;

    private FamilyLinkRegistry(Map<OutcomeFamily, Map<LinkFunction, FamilyLinkEntry>> entries) {
        this.entries = entries;
    }

    public static FamilyLinkRegistry getDefault() {
        return Holder.INSTANCE;
    }

    private static FamilyLinkRegistry loadDefault() {
        try (InputStream is = FamilyLinkRegistry.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(RESOURCE + " not found on classpath");
            }
            FamilyLinkRegistry registry = load(is);
            for (OutcomeFamily f : OutcomeFamily.values()) {
                if (!registry.entries.containsKey(f)) {
                    throw new IllegalStateException("No link registered for family " + f.getFamilyName());
                }
            }
            logger.info("Loaded family/link registry: {} families, {} combinations",
                    registry.entries.size(), registry.size());
            return registry;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
    }

    public static FamilyLinkRegistry load(InputStream jsonStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        TableRow[] rows = mapper.readValue(jsonStream, TableRow[].class);
        return fromRows(List.of(rows));
    }

    static FamilyLinkRegistry fromRows(List<TableRow> rows) {
        Map<OutcomeFamily, Map<LinkFunction, FamilyLinkEntry>> table = new EnumMap<>(OutcomeFamily.class);
        for (TableRow row : rows) {
            FamilyLinkEntry entry = validate(row);
            Map<LinkFunction, FamilyLinkEntry> links = table.computeIfAbsent(entry.getFamily(),
                    f -> new LinkedHashMap<>());
            if (!links.isEmpty()) {
                FamilyLinkEntry first = links.values().iterator().next();
                if (!first.getKernelName().equals(entry.getKernelName())
                        || first.hasAuxiliary() != entry.hasAuxiliary()
                        || (entry.hasAuxiliary() && (!first.getAuxiliaryName().equals(entry.getAuxiliaryName())
                                || first.getAuxiliaryDomain() != entry.getAuxiliaryDomain()))) {
                    throw new IllegalStateException("Rows for family " + row.family + " disagree on kernel or auxiliary parameter");
                }
            }
            if (links.put(entry.getLink(), entry) != null) {
                throw new IllegalStateException("Duplicate registry row " + row.family + "/" + row.link);
            }
        }
        Map<OutcomeFamily, Map<LinkFunction, FamilyLinkEntry>> frozen = new EnumMap<>(OutcomeFamily.class);
        for (Map.Entry<OutcomeFamily, Map<LinkFunction, FamilyLinkEntry>> e : table.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        return new FamilyLinkRegistry(Collections.unmodifiableMap(frozen));
    }

    private static FamilyLinkEntry validate(TableRow row) {
        OutcomeFamily family = OutcomeFamily.fromName(row.family);
        if (family == null) {
            throw new IllegalStateException("Unknown family in registry table: " + row.family);
        }
        LinkFunction link = LinkFunction.fromName(row.link);
        if (link == null) {
            throw new IllegalStateException("Unknown link in registry table: " + row.link);
        }
        if (row.kernel == null || row.kernel.isBlank()) {
            throw new IllegalStateException("Missing kernel for " + row.family + "/" + row.link);
        }
        String inverse = row.linkInverse == null ? "" : row.linkInverse;
        if (!inverse.equals(link.getInverseName())) {
            throw new IllegalStateException("Link inverse '" + inverse + "' does not invert link " + row.link);
        }
        if (!link.getInverseRange().isWithin(family.getLocationDomain())) {
            throw new IllegalStateException("Link " + row.link + " maps onto " + link.getInverseRange().getLabel()
                    + " values, outside the location domain of " + row.family);
        }
        String auxName = null;
        ValueDomain auxDomain = null;
        if (row.hasAuxiliary) {
            if (row.auxiliaryName == null || row.auxiliaryName.isBlank() || row.auxiliaryDomain == null) {
                throw new IllegalStateException("Auxiliary parameter of " + row.family + " needs a name and domain");
            }
            auxName = row.auxiliaryName;
            auxDomain = ValueDomain.fromLabel(row.auxiliaryDomain);
            if (auxDomain != ValueDomain.REAL && auxDomain != ValueDomain.POSITIVE) {
                throw new IllegalStateException("Auxiliary parameter domain must be real or positive");
            }
        }
        return new FamilyLinkEntry(family, link, row.kernel, auxName, auxDomain);
    }

    public FamilyLinkEntry resolve(String familyName, String linkName) {
        OutcomeFamily family = OutcomeFamily.fromName(familyName);
        LinkFunction link = LinkFunction.fromName(linkName);
        if (family == null || link == null) {
            throw new UnsupportedCombinationException("Unsupported family/link combination: "
                    + familyName + "/" + linkName);
        }
        return resolve(family, link);
    }

    public FamilyLinkEntry resolve(OutcomeFamily family, LinkFunction link) {
        Map<LinkFunction, FamilyLinkEntry> links = entries.get(family);
        FamilyLinkEntry entry = links == null ? null : links.get(link);
        if (entry == null) {
            throw new UnsupportedCombinationException("Unsupported family/link combination: "
                    + family.getFamilyName() + "/" + link.getLinkName());
        }
        return entry;
    }

    /**
     * Link names registered for a family, in table order. Empty for an unknown family.
     */
    public Set<String> supportedLinks(String familyName) {
        OutcomeFamily family = OutcomeFamily.fromName(familyName);
        Map<LinkFunction, FamilyLinkEntry> links = family == null ? null : entries.get(family);
        if (links == null) {
            return Collections.emptySet();
        }
        Set<String> names = new LinkedHashSet<>();
        for (LinkFunction l : links.keySet()) {
            names.add(l.getLinkName());
        }
        return Collections.unmodifiableSet(names);
    }

    public Set<String> supportedFamilies() {
        Set<String> names = new LinkedHashSet<>();
        for (OutcomeFamily f : entries.keySet()) {
            names.add(f.getFamilyName());
        }
        return Collections.unmodifiableSet(names);
    }

    public int size() {
        int n = 0;
        for (Map<LinkFunction, FamilyLinkEntry> links : entries.values()) {
            n += links.size();
        }
        return n;
    }
}
