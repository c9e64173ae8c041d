package org.carball.planlens.parser.mssql;

/**
 * One {@code <RelOp>} occurrence. {@code body} is the operator's own text outside
 * its child RelOps, both before the first child and after each child closes.
 * {@code parentIndex} is the enclosing RelOp's index or -1.
 */
record RelOpSegment(int index, int parentIndex, String openTag, String body) {

    String text() {
        return openTag + body;
    }
}
