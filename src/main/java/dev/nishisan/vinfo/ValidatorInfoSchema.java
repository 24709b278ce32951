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

package dev.nishisan.vinfo;

import dev.nishisan.vinfo.cell.AliasListCell;
import dev.nishisan.vinfo.cell.BindingListCell;
import dev.nishisan.vinfo.cell.DurationCell;
import dev.nishisan.vinfo.cell.EnabledCell;
import dev.nishisan.vinfo.cell.FloatCell;
import dev.nishisan.vinfo.cell.IntegerCell;
import dev.nishisan.vinfo.cell.StateCell;
import dev.nishisan.vinfo.cell.TextCell;
import dev.nishisan.vinfo.enrich.BindingEnricher;
import dev.nishisan.vinfo.enrich.EnabledStateEnricher;
import dev.nishisan.vinfo.enrich.RunStateEnricher;
import dev.nishisan.vinfo.enrich.SoftwareVersionEnricher;
import dev.nishisan.vinfo.probe.AddressResolver;
import dev.nishisan.vinfo.probe.PackageVersionProbe;
import dev.nishisan.vinfo.probe.ProcessControlProbe;
import dev.nishisan.vinfo.probe.SocketTableProbe;
import dev.nishisan.vinfo.query.RangeQueryEngine;
import dev.nishisan.vinfo.schema.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Declares the layout of a validator statistics record and wires the live-state enrichers into
 * it.
 */
public final class ValidatorInfoSchema {

    public static final String RESPONSE_VERSION = "response-version";
    public static final String TIMESTAMP = "timestamp";
    public static final String UPDATE_TIME = RangeQueryEngine.UPDATE_TIME_FIELD;
    public static final String NODE_INFO = "Node_info";
    public static final String STATE = "state";
    public static final String ENABLED = "enabled";
    public static final String POOL_INFO = "Pool_info";
    public static final String SOFTWARE = "Software";

    public static final String NAME = "Name";
    public static final String DID = "did";
    public static final String VERKEY = "verkey";
    public static final String BLS_KEY = "BLS_key";
    public static final String NODE_PORT = "Node_port";
    public static final String CLIENT_PORT = "Client_port";
    public static final String METRICS = "Metrics";

    public static final String UPTIME = "uptime";
    public static final String TRANSACTION_COUNT = "transaction-count";
    public static final String LEDGER = "ledger";
    public static final String POOL = "pool";
    public static final String CONFIG = "config";
    public static final String AUDIT = "audit";
    public static final String AVERAGE_PER_SECOND = "average-per-second";
    public static final String READ_TRANSACTIONS = "read-transactions";
    public static final String WRITE_TRANSACTIONS = "write-transactions";

    public static final String TOTAL_NODES_COUNT = "Total_nodes_count";
    public static final String REACHABLE_NODES_COUNT = "Reachable_nodes_count";
    public static final String REACHABLE_NODES = "Reachable_nodes";
    public static final String UNREACHABLE_NODES_COUNT = "Unreachable_nodes_count";
    public static final String UNREACHABLE_NODES = "Unreachable_nodes";

    private ValidatorInfoSchema() {
    }

    /**
     * Builds the record schema.
     *
     * @param probes   live system probes used to fill unknown fields
     * @param packages packages listed under {@value #SOFTWARE}, in report order
     * @return the root schema
     */
    public static Schema create(Probes probes, List<String> packages) {
        Objects.requireNonNull(probes, "probes");
        Objects.requireNonNull(packages, "packages");
        BindingEnricher bindings = new BindingEnricher(probes.socketTable(), probes.addressResolver());

        Schema transactionCount = Schema.builder(TRANSACTION_COUNT)
                .cell(LEDGER, IntegerCell.KIND)
                .cell(POOL, IntegerCell.KIND)
                .cell(CONFIG, IntegerCell.KIND)
                .cell(AUDIT, IntegerCell.KIND)
                .build();
        Schema averagePerSecond = Schema.builder(AVERAGE_PER_SECOND)
                .cell(READ_TRANSACTIONS, FloatCell.KIND)
                .cell(WRITE_TRANSACTIONS, FloatCell.KIND)
                .build();
        Schema metrics = Schema.builder(METRICS)
                .cell(UPTIME, DurationCell.KIND)
                .nested(TRANSACTION_COUNT, transactionCount)
                .nested(AVERAGE_PER_SECOND, averagePerSecond)
                .build();
        Schema nodeInfo = Schema.builder(NODE_INFO)
                .cell(NAME, TextCell.KIND)
                .cell(DID, TextCell.KIND)
                .cell(VERKEY, TextCell.KIND)
                .cell(BLS_KEY, TextCell.KIND)
                .cell(NODE_PORT, BindingListCell.KIND, bindings)
                .cell(CLIENT_PORT, BindingListCell.KIND, bindings)
                .nested(METRICS, metrics)
                .build();
        Schema poolInfo = Schema.builder(POOL_INFO)
                .cell(TOTAL_NODES_COUNT, IntegerCell.KIND)
                .cell(REACHABLE_NODES_COUNT, IntegerCell.KIND)
                .cell(REACHABLE_NODES, AliasListCell.KIND)
                .cell(UNREACHABLE_NODES_COUNT, IntegerCell.KIND)
                .cell(UNREACHABLE_NODES, AliasListCell.KIND)
                .build();
        Schema.Builder software = Schema.builder(SOFTWARE);
        SoftwareVersionEnricher versions = new SoftwareVersionEnricher(probes.packageVersions());
        for (String pkg : packages) {
            software.cell(pkg, TextCell.KIND, versions);
        }

        return Schema.builder("ValidatorInfo")
                .cell(RESPONSE_VERSION, TextCell.KIND)
                .cell(TIMESTAMP, IntegerCell.KIND)
                .cell(UPDATE_TIME, TextCell.KIND)
                .nested(NODE_INFO, nodeInfo)
                .cell(STATE, StateCell.KIND, new RunStateEnricher(probes.processControl()))
                .cell(ENABLED, EnabledCell.KIND, new EnabledStateEnricher(probes.processControl()))
                .nested(POOL_INFO, poolInfo)
                .nested(SOFTWARE, software.build())
                .build();
    }

    /**
     * The live system probes consulted by enrichment.
     *
     * @param socketTable     listening sockets by port
     * @param addressResolver local address to network notation
     * @param processControl  validator run and enabled state
     * @param packageVersions installed package versions
     */
    public record Probes(SocketTableProbe socketTable, AddressResolver addressResolver,
                         ProcessControlProbe processControl, PackageVersionProbe packageVersions) {

        public Probes {
            Objects.requireNonNull(socketTable, "socketTable");
            Objects.requireNonNull(addressResolver, "addressResolver");
            Objects.requireNonNull(processControl, "processControl");
            Objects.requireNonNull(packageVersions, "packageVersions");
        }
    }
}
