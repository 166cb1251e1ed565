package Dto;

/**
 * A row that can be written as one line of a delimited artifact.
 * <p>
 * Values are looked up by their column name so that a sink can follow the column order of
 * the dataset instead of the field order of the class.
 */
public interface TabularRecord {

    /**
     * @param column a column name of the owning dataset
     * @return the scalar value of that column, or {@code null} when the cell is empty
     * @throws IllegalArgumentException if the column does not belong to this row type
     */
    Object get(String column);
}
