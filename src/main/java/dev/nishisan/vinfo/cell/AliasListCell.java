/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.vinfo.cell;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.nishisan.vinfo.render.VerbosityFilter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * List of pool member aliases.
 * <p>
 * Entries are either plain strings or arrays whose first element is the alias (the
 * {@code [alias, rank]} form). The stored array is kept as is, so the JSON form matches the
 * record. Rendering de-duplicates the aliases and puts each on its own line prefixed with
 * {@link VerbosityFilter#MARKER}, so the narrative report only shows them in verbose mode.
 */
public final class AliasListCell extends ValueCell<JsonNode> {

    public static final CellKind<AliasListCell> KIND = new CellKind<>() {
        @Override
        public FieldOutcome<AliasListCell> wrap(JsonNode raw) {
            if (CellKind.isAbsent(raw)) {
                return FieldOutcome.parsed(unknown());
            }
            if (!raw.isArray()) {
                return FieldOutcome.malformed("expected an alias list but got " + raw.getNodeType());
            }
            for (JsonNode entry : raw) {
                if (!aliasOf(entry).isTextual()) {
                    return FieldOutcome.malformed("alias entry is not a string: " + entry);
                }
            }
            return FieldOutcome.parsed(new AliasListCell(raw.deepCopy()));
        }

        @Override
        public AliasListCell unknown() {
            return new AliasListCell(null);
        }

        @Override
        public String name() {
            return "alias-list";
        }
    };

    private AliasListCell(JsonNode entries) {
        super(entries);
    }

    /**
     * Creates a cell holding plain alias entries.
     *
     * @param aliases the aliases, in order
     * @return the cell
     */
    public static AliasListCell of(List<String> aliases) {
        ArrayNode entries = JsonNodeFactory.instance.arrayNode();
        aliases.forEach(entries::add);
        return new AliasListCell(entries);
    }

    /**
     * Returns the distinct aliases in first-seen order, or an empty list when unknown.
     *
     * @return the aliases
     */
    public List<String> aliases() {
        JsonNode entries = rawValue();
        if (entries == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (JsonNode entry : entries) {
            unique.add(aliasOf(entry).asText());
        }
        return List.copyOf(unique);
    }

    @Override
    public JsonNode toJson() {
        return isUnknown() ? super.toJson() : rawValue().deepCopy();
    }

    @Override
    protected String unknownText() {
        return VerbosityFilter.MARKER + UNKNOWN;
    }

    @Override
    protected String format(JsonNode entries) {
        List<String> aliases = aliases();
        List<String> lines = new ArrayList<>(aliases.size());
        for (String alias : aliases) {
            lines.add(VerbosityFilter.MARKER + alias);
        }
        return String.join("\n", lines);
    }

    private static JsonNode aliasOf(JsonNode entry) {
        return entry.isArray() && entry.size() > 0 ? entry.get(0) : entry;
    }
}
