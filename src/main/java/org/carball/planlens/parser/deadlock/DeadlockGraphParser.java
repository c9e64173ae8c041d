package org.carball.planlens.parser.deadlock;

import lombok.extern.slf4j.Slf4j;
import org.carball.planlens.model.deadlock.DeadlockGraph;
import org.carball.planlens.model.deadlock.DeadlockParticipant;
import org.carball.planlens.model.deadlock.LockHolder;
import org.carball.planlens.model.deadlock.LockResource;
import org.carball.planlens.model.deadlock.WaitForEdge;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.parser.CompressedPayloadDecoder;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a wait-for graph from a SQL Server deadlock report. Unlike ShowPlan
 * this format is parsed with a real DOM parser. Lock owners and waiters that
 * reference unknown processes are dropped and reported in
 * {@link DeadlockGraph#getParseWarnings()}. Never throws; unreadable input
 * yields {@link DeadlockGraph#failed(String, String)}.
 */
@Slf4j
public class DeadlockGraphParser {

    public DeadlockGraph parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return DeadlockGraph.failed(payload == null ? "" : payload, "Empty deadlock report");
        }

        String xml = payload;
        if (CompressedPayloadDecoder.isCompressed(payload)) {
            try {
                xml = CompressedPayloadDecoder.decode(payload);
            } catch (IOException e) {
                log.warn("Could not decompress deadlock report: {}", e.getMessage());
                return DeadlockGraph.failed(payload, "Could not decompress deadlock report: " + e.getMessage());
            }
        }

        try {
            return toGraph(parseDocument(xml), xml);
        } catch (ParserConfigurationException | SAXException | IOException | RuntimeException e) {
            log.warn("Failed to parse deadlock graph: {}", e.getMessage());
            log.debug("Parse failure details", e);
            return DeadlockGraph.failed(xml, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private DeadlockGraph toGraph(Document document, String xml) {
        Element deadlock = firstElement(document.getDocumentElement(), "deadlock");
        if (deadlock == null) {
            return DeadlockGraph.failed(xml, "No deadlock element found");
        }

        String victimId = victimId(deadlock);
        List<String> warnings = new ArrayList<>();

        Map<String, DeadlockParticipant> participants = new LinkedHashMap<>();
        for (Element process : childElements(firstElement(deadlock, "process-list"), "process")) {
            DeadlockParticipant participant = toParticipant(process, victimId);
            participants.put(participant.getProcessId(), participant);
        }

        List<LockResource> resources = new ArrayList<>();
        List<WaitForEdge> edges = new ArrayList<>();
        for (Element resource : childElements(firstElement(deadlock, "resource-list"), null)) {
            List<LockHolder> owners = holders(resource, "owner-list", "owner", participants, warnings);
            List<LockHolder> waiters = holders(resource, "waiter-list", "waiter", participants, warnings);

            int resourceIndex = resources.size();
            resources.add(LockResource.builder()
                    .resourceType(resource.getTagName())
                    .objectName(attr(resource, "objectname"))
                    .indexName(attr(resource, "indexname"))
                    .mode(attr(resource, "mode"))
                    .owners(owners)
                    .waiters(waiters)
                    .build());

            for (LockHolder owner : owners) {
                for (LockHolder waiter : waiters) {
                    edges.add(new WaitForEdge(owner.participantId(), waiter.participantId(), resourceIndex,
                            owner.mode(), waiter.mode()));
                }
            }
        }

        if (victimId != null && !participants.containsKey(victimId)) {
            warnings.add("Victim " + victimId + " does not match any process");
            log.warn("Deadlock victim {} does not match any process", victimId);
        }

        log.debug("Parsed deadlock graph with {} participants, {} resources and {} edges",
                participants.size(), resources.size(), edges.size());

        return DeadlockGraph.builder()
                .outcome(participants.isEmpty() ? ParseOutcome.EMPTY : ParseOutcome.PARSED)
                .participants(List.copyOf(participants.values()))
                .resources(resources)
                .edges(edges)
                .victimId(participants.containsKey(victimId) ? victimId : null)
                .parseWarnings(warnings)
                .rawXml(xml)
                .build();
    }

    /**
     * First {@code victim-list/victimProcess/@id}, falling back to the
     * {@code victim} attribute used by older report formats.
     */
    private static String victimId(Element deadlock) {
        Element victimList = firstElement(deadlock, "victim-list");
        for (Element victim : childElements(victimList, "victimProcess")) {
            String id = attr(victim, "id");
            if (id != null) {
                return id;
            }
        }
        return attr(deadlock, "victim");
    }

    private static DeadlockParticipant toParticipant(Element process, String victimId) {
        String id = attr(process, "id");
        Element inputBuffer = firstElement(process, "inputbuf");
        return DeadlockParticipant.builder()
                .processId(id)
                .sessionId(attr(process, "spid"))
                .status(attr(process, "status"))
                .waitResource(attr(process, "waitresource"))
                .waitTimeMs(parseLong(attr(process, "waittime")))
                .lockMode(attr(process, "lockMode"))
                .transactionName(attr(process, "transactionname"))
                .isolationLevel(attr(process, "isolationlevel"))
                .hostName(attr(process, "hostname"))
                .loginName(attr(process, "loginname"))
                .clientApp(attr(process, "clientapp"))
                .database(attr(process, "currentdbname"))
                .inputQuery(inputBuffer != null ? inputBuffer.getTextContent().trim() : null)
                .victim(id != null && id.equals(victimId))
                .build();
    }

    private static List<LockHolder> holders(Element resource, String listName, String holderName,
                                            Map<String, DeadlockParticipant> participants, List<String> warnings) {
        List<LockHolder> holders = new ArrayList<>();
        for (Element holder : childElements(firstElement(resource, listName), holderName)) {
            String id = attr(holder, "id");
            DeadlockParticipant participant = id != null ? participants.get(id) : null;
            if (participant == null) {
                String warning = "Dropped " + holderName + " " + id + " of " + resource.getTagName()
                        + " with no matching process";
                warnings.add(warning);
                log.warn(warning);
                continue;
            }
            holders.add(new LockHolder(id, attr(holder, "mode"), participant.isVictim()));
        }
        return holders;
    }

    static Document parseDocument(String xml) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                log.debug("Deadlock XML warning: {}", e.getMessage());
            }

            @Override
            public void error(SAXParseException e) throws SAXException {
                throw e;
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        });
        return builder.parse(new InputSource(new StringReader(xml.trim())));
    }

    /**
     * The element itself when it has the given name, otherwise its first descendant with that name.
     */
    private static Element firstElement(Element parent, String name) {
        if (parent == null) {
            return null;
        }
        if (name.equals(parent.getTagName())) {
            return parent;
        }
        NodeList found = parent.getElementsByTagName(name);
        return found.getLength() > 0 ? (Element) found.item(0) : null;
    }

    private static List<Element> childElements(Element parent, String name) {
        List<Element> children = new ArrayList<>();
        if (parent == null) {
            return children;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element element && (name == null || name.equals(element.getTagName()))) {
                children.add(element);
            }
        }
        return children;
    }

    private static String attr(Element element, String name) {
        if (element == null) {
            return null;
        }
        String value = element.getAttribute(name);
        return value.isEmpty() ? null : value;
    }

    private static long parseLong(String value) {
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
