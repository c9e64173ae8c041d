package org.carball.planlens.parser.deadlock;

import org.carball.planlens.model.deadlock.DeadlockGraph;
import org.carball.planlens.model.deadlock.DeadlockParticipant;
import org.carball.planlens.model.deadlock.LockResource;
import org.carball.planlens.model.deadlock.WaitForEdge;
import org.carball.planlens.model.plan.ParseOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

public class DeadlockGraphParserTest {

    static final String DEADLOCK_XML = """
            <event name="xml_deadlock_report" package="sqlserver">
              <data name="xml_report">
                <value>
                  <deadlock>
                    <victim-list>
                      <victimProcess id="process2"/>
                    </victim-list>
                    <process-list>
                      <process id="process1" spid="51" status="suspended" waitresource="KEY: 5:72057594 (a1b2)"
                               waittime="4200" lockMode="X" transactionname="user_transaction"
                               isolationlevel="read committed (2)" hostname="APP01" loginname="app"
                               clientapp="OrdersService" currentdbname="Shop">
                        <inputbuf>UPDATE dbo.Orders SET Status = 2 WHERE OrderID = 1</inputbuf>
                      </process>
                      <process id="process2" spid="52" status="suspended" waitresource="KEY: 5:72057594 (c3d4)"
                               waittime="4100" isolationlevel="serializable (4)" currentdbname="Shop">
                        <inputbuf>UPDATE dbo.Orders SET Status = 3 WHERE OrderID = 2</inputbuf>
                      </process>
                    </process-list>
                    <resource-list>
                      <keylock objectname="Shop.dbo.Orders" indexname="PK_Orders" mode="X">
                        <owner-list>
                          <owner id="process1" mode="X"/>
                        </owner-list>
                        <waiter-list>
                          <waiter id="process2" mode="U" requestType="wait"/>
                        </waiter-list>
                      </keylock>
                    </resource-list>
                  </deadlock>
                </value>
              </data>
            </event>
            """;

    private DeadlockGraphParser parser;

    @BeforeEach
    void setUp() {
        parser = new DeadlockGraphParser();
    }

    @Test
    public void shouldBuildSingleOwnerToWaiterEdge() {
        // When
        DeadlockGraph graph = parser.parse(DEADLOCK_XML);

        // Then
        assertThat(graph.getOutcome()).isEqualTo(ParseOutcome.PARSED);
        assertThat(graph.getParticipants()).hasSize(2);
        assertThat(graph.getEdges()).containsExactly(new WaitForEdge("process1", "process2", 0, "X", "U"));
        assertThat(graph.getParticipants()).filteredOn(DeadlockParticipant::isVictim)
                .extracting(DeadlockParticipant::getProcessId)
                .containsExactly("process2");
        assertThat(graph.getVictimId()).isEqualTo("process2");
        assertThat(graph.getParseWarnings()).isEmpty();
    }

    @Test
    public void shouldReadProcessAttributes() {
        // When
        DeadlockGraph graph = parser.parse(DEADLOCK_XML);

        // Then
        DeadlockParticipant first = graph.findParticipant("process1").orElseThrow();
        assertThat(first.getSessionId()).isEqualTo("51");
        assertThat(first.getWaitTimeMs()).isEqualTo(4200);
        assertThat(first.getLockMode()).isEqualTo("X");
        assertThat(first.getTransactionName()).isEqualTo("user_transaction");
        assertThat(first.getHostName()).isEqualTo("APP01");
        assertThat(first.getClientApp()).isEqualTo("OrdersService");
        assertThat(first.getDatabase()).isEqualTo("Shop");
        assertThat(first.getInputQuery()).isEqualTo("UPDATE dbo.Orders SET Status = 2 WHERE OrderID = 1");
    }

    @Test
    public void shouldReadLockResources() {
        // When
        DeadlockGraph graph = parser.parse(DEADLOCK_XML);

        // Then
        assertThat(graph.getResources()).hasSize(1);
        LockResource resource = graph.getResources().get(0);
        assertThat(resource.getResourceType()).isEqualTo("keylock");
        assertThat(resource.getObjectName()).isEqualTo("Shop.dbo.Orders");
        assertThat(resource.getIndexName()).isEqualTo("PK_Orders");
        assertThat(resource.getWaiters().get(0).victim()).isTrue();
        assertThat(resource.getOwners().get(0).victim()).isFalse();
    }

    @Test
    public void shouldDropHoldersWithUnknownProcess() {
        // Given
        String xml = """
                <deadlock victim="p1">
                  <process-list>
                    <process id="p1" spid="60"/>
                  </process-list>
                  <resource-list>
                    <pagelock objectname="Shop.dbo.Items" mode="IX">
                      <owner-list><owner id="p9" mode="IX"/></owner-list>
                      <waiter-list><waiter id="p1" mode="S"/></waiter-list>
                    </pagelock>
                  </resource-list>
                </deadlock>
                """;

        // When
        DeadlockGraph graph = parser.parse(xml);

        // Then
        assertThat(graph.getEdges()).isEmpty();
        assertThat(graph.getResources().get(0).getOwners()).isEmpty();
        assertThat(graph.getParseWarnings()).hasSize(1);
        assertThat(graph.getParseWarnings().get(0)).contains("p9");
        assertThat(graph.getVictimId()).isEqualTo("p1");
    }

    @Test
    public void shouldLeaveVictimEmptyWhenNoneListed() {
        // Given
        String xml = "<deadlock><process-list><process id=\"a\"/><process id=\"b\"/></process-list></deadlock>";

        // When
        DeadlockGraph graph = parser.parse(xml);

        // Then
        assertThat(graph.getVictim()).isEmpty();
        assertThat(graph.getVictimId()).isNull();
        assertThat(graph.getParticipants()).noneMatch(DeadlockParticipant::isVictim);
    }

    @Test
    public void shouldDecompressGzipPayload() throws IOException {
        // Given
        String payload = "COMPRESSED_XML:" + gzipBase64(DEADLOCK_XML);

        // When
        DeadlockGraph graph = parser.parse(payload);

        // Then
        assertThat(graph.getOutcome()).isEqualTo(ParseOutcome.PARSED);
        assertThat(graph.getEdges()).hasSize(1);
    }

    @Test
    public void shouldFailGracefullyOnCorruptCompressedPayload() {
        // When
        DeadlockGraph graph = parser.parse("COMPRESSED_XML:bm90IGd6aXA=");

        // Then
        assertThat(graph.isFailed()).isTrue();
        assertThat(graph.getRawXml()).isEqualTo("COMPRESSED_XML:bm90IGd6aXA=");
    }

    @Test
    public void shouldKeepRawTextWhenXmlIsMalformed() {
        // Given
        String xml = "<deadlock><process-list><process id=\"a\"></deadlock>";

        // When
        DeadlockGraph graph = parser.parse(xml);

        // Then
        assertThat(graph.isFailed()).isTrue();
        assertThat(graph.getOutcome()).isEqualTo(ParseOutcome.UNRECOGNIZED);
        assertThat(graph.getRawXml()).isEqualTo(xml);
        assertThat(graph.getParticipants()).isEmpty();
    }

    @Test
    public void shouldRejectDoctypeDeclarations() {
        // Given
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE d [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                + "<deadlock><process-list><process id=\"&x;\"/></process-list></deadlock>";

        // When
        DeadlockGraph graph = parser.parse(xml);

        // Then
        assertThat(graph.isFailed()).isTrue();
    }

    private static String gzipBase64(String text) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
            gzip.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }
}
