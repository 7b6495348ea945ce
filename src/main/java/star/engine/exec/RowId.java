package star.engine.exec;

// Physical position of a row: partition, row group within the partition, row within the group.
public record RowId(int partition, int rowGroup, int row) {
    @Override
    public String toString() {
        return "(" + partition + "," + rowGroup + "," + row + ")";
    }
}
