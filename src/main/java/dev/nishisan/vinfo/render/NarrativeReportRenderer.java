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

package dev.nishisan.vinfo.render;

import dev.nishisan.vinfo.schema.SchemaNode;

import java.util.ArrayList;
import java.util.List;

import static dev.nishisan.vinfo.ValidatorInfoSchema.*;

/**
 * Fixed-layout validator status summary.
 * <p>
 * Lines starting with {@link VerbosityFilter#MARKER} are only shown in verbose mode. Multi-line
 * values, such as alias lists, contribute one line each.
 */
public final class NarrativeReportRenderer {

    public String render(SchemaNode record, boolean verbose) {
        SchemaNode node = record.node(NODE_INFO);
        SchemaNode metrics = node.node(METRICS);
        SchemaNode txns = metrics.node(TRANSACTION_COUNT);
        SchemaNode rates = metrics.node(AVERAGE_PER_SECOND);
        SchemaNode pool = record.node(POOL_INFO);
        SchemaNode software = record.node(SOFTWARE);
        String total = text(pool, TOTAL_NODES_COUNT);

        List<String> lines = new ArrayList<>();
        lines.add("Validator " + text(node, NAME) + " is " + text(record, STATE));
        lines.add("#Service:           " + text(record, ENABLED));
        lines.add("Update time:        " + text(record, UPDATE_TIME));
        lines.add("Validator DID:      " + text(node, DID));
        lines.add("Verification Key:   " + text(node, VERKEY));
        lines.add("#BLS Key:           " + text(node, BLS_KEY));
        lines.add("Node Port:          " + text(node, NODE_PORT));
        lines.add("Client Port:        " + text(node, CLIENT_PORT));
        lines.add("Metrics:");
        lines.add("  Uptime: " + text(metrics, UPTIME));
        lines.add("#  Total Config Transactions:  " + text(txns, CONFIG));
        lines.add("  Total Ledger Transactions:  " + text(txns, LEDGER));
        lines.add("  Total Pool Transactions:    " + text(txns, POOL));
        lines.add("#  Total Audit Transactions:   " + text(txns, AUDIT));
        lines.add("  Read Transactions/Seconds:  " + text(rates, READ_TRANSACTIONS));
        lines.add("  Write Transactions/Seconds: " + text(rates, WRITE_TRANSACTIONS));
        lines.add("Reachable Hosts:   " + text(pool, REACHABLE_NODES_COUNT) + "/" + total);
        addMultiline(lines, text(pool, REACHABLE_NODES));
        lines.add("Unreachable Hosts: " + text(pool, UNREACHABLE_NODES_COUNT) + "/" + total);
        addMultiline(lines, text(pool, UNREACHABLE_NODES));
        lines.add("#Software Versions:");
        for (String pkg : software.fieldNames()) {
            lines.add("#  " + pkg + ": " + text(software, pkg));
        }
        return String.join("\n", VerbosityFilter.apply(lines, verbose));
    }

    private static String text(SchemaNode node, String field) {
        return node.cell(field).render();
    }

    private static void addMultiline(List<String> lines, String text) {
        if (text.isEmpty()) {
            return;
        }
        for (String line : text.split("\n")) {
            lines.add(line);
        }
    }
}
