package domain.run;

/** What an incremental run did to its target table. */
public enum IncrementalAction {
    /** First run or full refresh: CREATE TABLE AS + primary key. */
    CREATED_TABLE,
    /** MERGE into the existing table. */
    MERGED,
    /** INSERT ... ON CONFLICT into the existing table (server without MERGE). */
    UPSERTED
}
