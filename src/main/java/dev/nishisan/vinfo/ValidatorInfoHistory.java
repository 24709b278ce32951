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

import dev.nishisan.vinfo.config.HistoryConfig;
import dev.nishisan.vinfo.probe.CommandRunner;
import dev.nishisan.vinfo.probe.DpkgPackageVersionProbe;
import dev.nishisan.vinfo.probe.IpAddrResolver;
import dev.nishisan.vinfo.probe.ProcessCommandRunner;
import dev.nishisan.vinfo.probe.SsSocketTableProbe;
import dev.nishisan.vinfo.query.RangeQuery;
import dev.nishisan.vinfo.query.RangeQueryEngine;
import dev.nishisan.vinfo.query.RecordDecodeException;
import dev.nishisan.vinfo.query.StoredRecord;
import dev.nishisan.vinfo.render.MissingPathException;
import dev.nishisan.vinfo.render.RenderRequest;
import dev.nishisan.vinfo.render.ReportRenderer;
import dev.nishisan.vinfo.store.RecordStore;
import dev.nishisan.vinfo.store.StoreLocator;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reports the stored statistics history of one or more validator nodes.
 * <p>
 * Stores are processed one at a time: opened, queried to completion, rendered and closed. A
 * corrupted store is reported and skipped without affecting the others.
 */
public final class ValidatorInfoHistory {
    private static final Logger LOGGER = Logger.getLogger(ValidatorInfoHistory.class.getName());

    private final HistoryConfig config;
    private final StoreLocator locator;
    private final RangeQueryEngine engine;
    private final ReportRenderer renderer;

    public ValidatorInfoHistory(HistoryConfig config, ValidatorInfoSchema.Probes probes) {
        this.config = Objects.requireNonNull(config, "config");
        this.locator = new StoreLocator(config.dataDir(), config.storeSuffix());
        this.engine = new RangeQueryEngine(config.zone());
        this.renderer = new ReportRenderer(ValidatorInfoSchema.create(probes, config.packages()));
    }

    /**
     * Creates a reporter wired to the local system's probes.
     *
     * @param config the settings
     * @return the reporter
     */
    public static ValidatorInfoHistory create(HistoryConfig config) {
        CommandRunner runner = new ProcessCommandRunner(config.probeTimeout());
        ValidatorInfoSchema.Probes probes = new ValidatorInfoSchema.Probes(
                new SsSocketTableProbe(runner),
                new IpAddrResolver(runner),
                config.processBackend().create(runner, config.serviceName()),
                new DpkgPackageVersionProbe(runner));
        return new ValidatorInfoHistory(config, probes);
    }

    /**
     * Reports the configured number of most recent records of the matching stores, using the
     * configured output mode and verbosity.
     *
     * @param selector node name glob, or {@code null} for all nodes
     * @param out      destination of the report
     * @return one report per store, in name order
     * @throws IOException if the data directory cannot be listed
     */
    public List<StoreReport> report(String selector, PrintStream out) throws IOException {
        return report(selector, RangeQuery.last(config.count()), RenderRequest.of(config.mode(), config.verbose()), out);
    }

    /**
     * Reports every store whose node name matches the selector.
     *
     * @param selector node name glob, or {@code null} for all nodes
     * @param query    record selection
     * @param request  rendering options
     * @param out      destination of the report
     * @return one report per store, in name order
     * @throws IOException if the data directory cannot be listed
     */
    public List<StoreReport> report(String selector, RangeQuery query, RenderRequest request, PrintStream out)
            throws IOException {
        List<StoreLocator.StoreLocation> locations = locator.locate(selector);
        if (locations.isEmpty()) {
            LOGGER.info(() -> "No stores match selector " + (selector == null ? "*" : selector));
        }
        List<StoreReport> reports = new ArrayList<>(locations.size());
        for (StoreLocator.StoreLocation location : locations) {
            RecordStore store;
            try {
                store = location.open();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Failed to open store " + location.path(), e);
                out.println("Failed to open store " + location.name() + ": " + e.getMessage());
                reports.add(new StoreReport(location.name(), 0, e));
                continue;
            }
            try (store) {
                reports.add(reportStore(store, query, request, out));
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Failed to close store " + location.path(), e);
            }
        }
        return reports;
    }

    /**
     * Reports a single, already opened store. The store is not closed.
     *
     * @param store   the store
     * @param query   record selection
     * @param request rendering options
     * @param out     destination of the report
     * @return the store report
     */
    public StoreReport reportStore(RecordStore store, RangeQuery query, RenderRequest request, PrintStream out) {
        List<StoredRecord> records;
        try {
            records = engine.query(store, query);
        } catch (RecordDecodeException e) {
            LOGGER.log(Level.WARNING, "Store " + store.name() + " contains a corrupted record", e);
            out.println("Failed to read store " + store.name() + ": " + e.getMessage());
            return new StoreReport(store.name(), 0, e);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to read store " + store.name(), e);
            out.println("Failed to read store " + store.name() + ": " + e.getMessage());
            return new StoreReport(store.name(), 0, e);
        }
        int rendered = 0;
        for (StoredRecord record : records) {
            try {
                out.println(renderer.render(record, request));
                out.println();
                rendered++;
            } catch (MissingPathException e) {
                out.println(e.getMessage());
                return new StoreReport(store.name(), rendered, e);
            }
        }
        return new StoreReport(store.name(), rendered, null);
    }
}
