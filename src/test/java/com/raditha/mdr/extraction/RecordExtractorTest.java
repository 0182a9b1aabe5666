package com.raditha.mdr.extraction;

import com.raditha.mdr.MiningFixtures;
import com.raditha.mdr.config.MiningConfig;
import com.raditha.mdr.distance.DistanceCalculator;
import com.raditha.mdr.distance.DistanceTables;
import com.raditha.mdr.model.DataRecord;
import com.raditha.mdr.model.DataRegion;
import com.raditha.mdr.model.GNode;
import com.raditha.mdr.model.NodeId;
import com.raditha.mdr.observer.MiningObserver;
import com.raditha.mdr.tree.JsoupDocumentTree;
import com.raditha.mdr.tree.NodeIndex;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordExtractorTest {

    private static RecordExtractor<Element> extractorFor(JsoupDocumentTree tree) {
        MiningConfig config = MiningConfig.defaults();
        NodeIndex<Element> index = new NodeIndex<>(tree);
        DistanceTables distances = new DistanceCalculator<>(
                index, config, MiningFixtures.DIGIT_BLIND, MiningObserver.SILENT).computeDistances();
        return new RecordExtractor<>(index, distances, config, MiningObserver.SILENT);
    }

    @Test
    void testRecords1SplitsSimilarChildren() {
        JsoupDocumentTree tree = MiningFixtures.page(
                "<ul><li><span>a1</span><span>a2</span><span>a3</span></li><li><span>b1</span></li></ul>");
        RecordExtractor<Element> extractor = extractorFor(tree);
        NodeId ul = new NodeId("ul", 0);
        NodeId li = new NodeId("li", 0);

        List<DataRecord> records = extractor.findRecords1(new GNode(ul, 0, 1));

        assertEquals(List.of(
                DataRecord.of(new GNode(li, 0, 1)),
                DataRecord.of(new GNode(li, 1, 2)),
                DataRecord.of(new GNode(li, 2, 3))), records);
    }

    @Test
    void testRecords1KeepsDissimilarChildrenTogether() {
        JsoupDocumentTree tree = MiningFixtures.page(
                "<ul><li><b>1</b><i>1</i></li><li><b>2</b><i>2</i></li></ul>");
        RecordExtractor<Element> extractor = extractorFor(tree);
        GNode first = new GNode(new NodeId("ul", 0), 0, 1);

        assertEquals(List.of(DataRecord.of(first)), extractor.findRecords1(first));
    }

    @Test
    void testRecords1NeverSplitsTableRows() {
        // jsoup inserts a tbody, so the rows sit at depth 4 under it
        JsoupDocumentTree tree = JsoupDocumentTree.parse(
                "<html><body><table><tr><td>1</td><td>2</td></tr><tr><td>3</td><td>4</td></tr></table></body></html>");
        RecordExtractor<Element> extractor = extractorFor(tree);
        GNode row = new GNode(new NodeId("tbody", 0), 0, 1);

        assertEquals(List.of(DataRecord.of(row)), extractor.findRecords1(row));
    }

    @Test
    void testRecords1WithoutChildScoresContributesNothing() {
        JsoupDocumentTree tree = MiningFixtures.page("<ul><li><a>1</a></li><li><a>2</a></li></ul>");
        RecordExtractor<Element> extractor = extractorFor(tree);

        assertTrue(extractor.findRecords1(new GNode(new NodeId("ul", 0), 0, 1)).isEmpty());
    }

    @Test
    void testRecordsNBuildsNonContiguousRecords() {
        JsoupDocumentTree tree = MiningFixtures.page(
                "<section>"
                        + "<div><b>x1</b><b>x2</b></div><p><i>y1</i><i>y2</i></p>"
                        + "<div><b>x3</b><b>x4</b></div><p><i>y3</i><i>y4</i></p>"
                        + "</section>");
        RecordExtractor<Element> extractor = extractorFor(tree);
        NodeId section = new NodeId("section", 0);
        NodeId div = new NodeId("div", 1);
        NodeId p = new NodeId("p", 0);

        List<DataRecord> records = extractor.findRecordsN(new GNode(section, 0, 2));

        assertEquals(List.of(
                DataRecord.of(new GNode(div, 0, 1), new GNode(p, 0, 1)),
                DataRecord.of(new GNode(div, 1, 2), new GNode(p, 1, 2))), records);
        assertTrue(records.get(0).isNonContiguous());
    }

    @Test
    void testRecordsNWithDifferentChildCounts() {
        JsoupDocumentTree tree = MiningFixtures.page(
                "<section><div><b>x1</b><b>x2</b></div><p><i>y1</i><i>y2</i><i>y3</i></p></section>");
        RecordExtractor<Element> extractor = extractorFor(tree);
        GNode gnode = new GNode(new NodeId("section", 0), 0, 2);

        assertEquals(List.of(DataRecord.of(gnode)), extractor.findRecordsN(gnode));
    }

    @Test
    void testRecordsNWithDissimilarChildren() {
        JsoupDocumentTree tree = MiningFixtures.page(
                "<section><div><b>x</b><i>x</i></div><p><i>y1</i><i>y2</i></p></section>");
        RecordExtractor<Element> extractor = extractorFor(tree);
        GNode gnode = new GNode(new NodeId("section", 0), 0, 2);

        assertEquals(List.of(DataRecord.of(gnode)), extractor.findRecordsN(gnode));
    }

    @Test
    void testRecordsNWithMissingChildScores() {
        JsoupDocumentTree tree = MiningFixtures.page("<section><h3>t1</h3><p>d1</p></section>");
        RecordExtractor<Element> extractor = extractorFor(tree);
        GNode gnode = new GNode(new NodeId("section", 0), 0, 2);

        assertEquals(List.of(DataRecord.of(gnode)), extractor.findRecordsN(gnode));
    }

    @Test
    void testFindDataRecordsDispatchesBySize() {
        JsoupDocumentTree tree = MiningFixtures.page(
                "<section>"
                        + "<div><b>x1</b><b>x2</b></div><p><i>y1</i><i>y2</i></p>"
                        + "<div><b>x3</b><b>x4</b></div><p><i>y3</i><i>y4</i></p>"
                        + "</section>");
        RecordExtractor<Element> extractor = extractorFor(tree);
        NodeId section = new NodeId("section", 0);

        List<DataRecord> records = extractor.findDataRecords(List.of(
                new DataRegion(section, 2, 0, 4),
                new DataRegion(new NodeId("div", 1), 1, 0, 2)));

        // 2 records per 2-node gnode, nothing for leaf cells
        assertEquals(4, records.size());
        assertTrue(records.stream().allMatch(DataRecord::isNonContiguous));
    }
}
