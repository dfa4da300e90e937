package com.codeasg.engine;

import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.graph.Asg;
import com.codeasg.engine.ir.AsgModel;
import com.codeasg.engine.ir.AsgSerializer;
import com.codeasg.engine.ir.NodeRefs;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AsgSerializerTest {

    private static Asg asg;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void build() {
        asg = Units.build(Units.fixture("queue.go"), Language.GO, "pkg/queue.go");
    }

    @Test
    void modelCoversEveryNodeAndEdge() {
        AsgModel.AsgRoot root = new AsgSerializer().toModel(asg);
        assertEquals(AsgSerializer.FORMAT_VERSION, root.formatVersion);
        assertEquals("go", root.language);
        assertEquals("pkg/queue.go", root.unit);
        assertEquals(asg.contentHash(), root.contentHash);
        assertFalse(root.degraded);
        assertEquals(asg.size(), root.nodes.size());
        assertEquals(asg.edges().size(), root.edges.size());
        assertEquals(asg.symbols().symbols().size(), root.symbols.size());
        assertTrue(root.parseErrors.isEmpty());

        AsgModel.AsgNode first = root.nodes.get(0);
        assertEquals("go::pkg/queue.go::0", first.id);
        assertEquals("Module", first.kind);
        assertEquals(0, first.startByte);
        assertTrue(root.edges.stream().anyMatch(e -> e.kind.equals("reaching_def")));
    }

    @Test
    void exportIsDeterministic() {
        Asg again = Units.build(Units.fixture("queue.go"), Language.GO, "pkg/queue.go");
        AsgSerializer serializer = new AsgSerializer();
        assertEquals(serializer.toJson(asg), serializer.toJson(again));
    }

    @Test
    void writesSnakeCaseJsonToSanitizedFile() throws IOException {
        Path out = new AsgSerializer().write(asg, tempDir.resolve("out"));
        assertEquals("pkg_queue.go.asg.json", out.getFileName().toString());
        assertTrue(Files.exists(out));

        JsonObject json = JsonParser.parseString(Files.readString(out)).getAsJsonObject();
        assertEquals("0.1", json.get("format_version").getAsString());
        assertTrue(json.has("content_hash"));
        assertTrue(json.has("parse_errors"));
        JsonObject node = json.getAsJsonArray("nodes").get(1).getAsJsonObject();
        assertTrue(node.has("start_byte"));
        assertTrue(node.has("raw_kind"));
    }

    @Test
    void nodeReferencesRoundTripTheId() {
        String ref = NodeRefs.forNode(Language.CPP, "lib::matrix.cpp", 42);
        assertEquals("cpp::lib::matrix.cpp::42", ref);
        assertEquals(42, NodeRefs.nodeId(ref));
        assertEquals("rust::stack.rs::symbol:7", NodeRefs.forSymbol(Language.RUST, "stack.rs", 7));
        assertThrows(IllegalArgumentException.class, () -> NodeRefs.nodeId("rust::stack.rs::symbol:7"));
        assertThrows(IllegalArgumentException.class, () -> NodeRefs.nodeId("plain"));
    }
}
