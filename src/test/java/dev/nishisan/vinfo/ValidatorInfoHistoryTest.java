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
import dev.nishisan.vinfo.probe.EnabledState;
import dev.nishisan.vinfo.probe.ProcessControlProbe;
import dev.nishisan.vinfo.probe.RunState;
import dev.nishisan.vinfo.probe.SocketEntry;
import dev.nishisan.vinfo.query.RangeQuery;
import dev.nishisan.vinfo.query.RecordDecodeException;
import dev.nishisan.vinfo.render.MissingPathException;
import dev.nishisan.vinfo.render.RenderMode;
import dev.nishisan.vinfo.render.RenderRequest;
import dev.nishisan.vinfo.store.InMemoryRecordStore;
import dev.nishisan.vinfo.store.RecordFileWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorInfoHistoryTest {

    @TempDir
    Path dataDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private ValidatorInfoHistory history(ValidatorInfoSchema.Probes probes) {
        HistoryConfig config = HistoryConfig.builder(dataDir)
                .zone(ZoneOffset.UTC)
                .packages(TestRecords.PACKAGES)
                .build();
        return new ValidatorInfoHistory(config, probes);
    }

    @Test
    void corruptedStoreDoesNotAffectItsSibling() throws IOException {
        Path good = dataDir.resolve("Node1_info_db");
        RecordFileWriter.append(good, 100L, TestRecords.sample(100));
        RecordFileWriter.append(good, 200L, TestRecords.sample(200));
        Path bad = dataDir.resolve("Node0_info_db");
        RecordFileWriter.append(bad, 100L, TestRecords.bytes("{broken"));

        List<StoreReport> reports = history(TestRecords.failingProbes())
                .report(null, RangeQuery.all(), RenderRequest.of(RenderMode.JSON, false), out);

        assertEquals(2, reports.size());
        assertEquals("Node0", reports.get(0).storeName());
        assertFalse(reports.get(0).succeeded());
        assertInstanceOf(RecordDecodeException.class, reports.get(0).failure());
        assertEquals("Node1", reports.get(1).storeName());
        assertTrue(reports.get(1).succeeded());
        assertEquals(2, reports.get(1).rendered());
        assertTrue(output().contains("Failed to read store Node0"));
        assertTrue(output().contains("1970-01-01 00:03:20 (200)"));
    }

    @Test
    void defaultReportShowsTheLatestRecordAsNarrative() throws IOException {
        Path file = dataDir.resolve("Node1_info_db");
        RecordFileWriter.append(file, 1_499_999_000L, TestRecords.sample(1_499_999_000L));
        RecordFileWriter.append(file, 1_500_000_000L, TestRecords.bytes(TestRecords.FULL));

        List<StoreReport> reports = history(TestRecords.failingProbes()).report("Node1", out);

        assertEquals(1, reports.get(0).rendered());
        assertTrue(output().startsWith("Validator Node1 is running\nUpdate time:        2017-07-14 02:40:00 (1500000000)\n"));
    }

    @Test
    void liveProbesFillUnknownFields() throws IOException {
        RecordFileWriter.append(dataDir.resolve("Node1_info_db"), 100L, TestRecords.bytes(
                "{\"Node_info\": {\"Name\": \"Node1\", \"Node_port\": 9701, \"Client_port\": 9702}}"));
        ProcessControlProbe processControl = new ProcessControlProbe() {
            @Override
            public RunState getRunState() {
                return RunState.RUNNING;
            }

            @Override
            public EnabledState getEnabledState() {
                return EnabledState.ENABLED;
            }
        };
        ValidatorInfoSchema.Probes probes = new ValidatorInfoSchema.Probes(
                port -> port == 9701 ? List.of(new SocketEntry("tcp", "10.0.0.2")) : List.of(),
                ip -> Optional.of(ip + "/24"),
                processControl,
                pkg -> pkg.equals("indy-node") ? Optional.of("1.13.0") : Optional.empty());

        history(probes).report(null, RangeQuery.last(1), RenderRequest.of(RenderMode.NARRATIVE, true), out);

        String text = output();
        assertTrue(text.startsWith("Validator Node1 is running\nService:           enabled\n"));
        assertTrue(text.contains("\nNode Port:          10.0.0.2/24:9701/tcp\n"));
        assertTrue(text.contains("\nClient Port:        no bindings found\n"));
        assertTrue(text.contains("\n  indy-node: 1.13.0\n  sovrin: unknown\n"));
    }

    @Test
    void missingFieldPathStopsThatStore() throws IOException {
        Path file = dataDir.resolve("Node1_info_db");
        RecordFileWriter.append(file, 100L, TestRecords.sample(100));
        RecordFileWriter.append(file, 200L, TestRecords.sample(200));

        List<StoreReport> reports = history(TestRecords.failingProbes()).report(null, RangeQuery.all(),
                new RenderRequest(RenderMode.JSON, false, true, "Pool_info"), out);

        assertEquals(0, reports.get(0).rendered());
        assertInstanceOf(MissingPathException.class, reports.get(0).failure());
        assertEquals("Field 'Pool_info' of path 'Pool_info' not found", output().trim());
    }

    @Test
    void createWiresTheLocalProbes() throws IOException {
        RecordFileWriter.append(dataDir.resolve("Node1_info_db"), 1_500_000_000L,
                TestRecords.bytes(TestRecords.FULL));
        HistoryConfig config = HistoryConfig.builder(dataDir)
                .zone(ZoneOffset.UTC)
                .mode(RenderMode.JSON)
                .build();

        List<StoreReport> reports = ValidatorInfoHistory.create(config).report("Node*", out);

        assertEquals(1, reports.size());
        assertTrue(reports.get(0).succeeded());
        assertEquals("running", TestRecords.parse(output()).get("state").asText());
    }

    @Test
    void singleStoreCanBeReportedDirectly() {
        InMemoryRecordStore store = new InMemoryRecordStore("Node7", Map.of(10L, TestRecords.sample(10)));

        StoreReport report = history(TestRecords.failingProbes())
                .reportStore(store, RangeQuery.last(1), RenderRequest.of(RenderMode.TREE, false), out);

        assertEquals(new StoreReport("Node7", 1, null), report);
        assertTrue(output().contains("\"Name\": Node1"));
    }

    @Test
    void unmatchedSelectorReportsNothing() throws IOException {
        Files.createFile(dataDir.resolve("Node1_info_db"));

        assertTrue(history(TestRecords.failingProbes()).report("Node9", out).isEmpty());
        assertEquals("", output());
    }

    @Test
    void missingDataDirectoryFails() {
        HistoryConfig config = HistoryConfig.builder(dataDir.resolve("absent")).build();
        ValidatorInfoHistory history = new ValidatorInfoHistory(config, TestRecords.failingProbes());

        assertThrows(IOException.class, () -> history.report(null, out));
    }
}
