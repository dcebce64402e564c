package com.billsync.billsync.upload;

import com.billsync.billsync.ingest.BillRecord;
import com.billsync.billsync.ingest.BillerContact;
import com.billsync.billsync.ingest.PaymentStatus;
import com.billsync.billsync.ingest.SurveyUnit;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.Date;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
public class JdbcBillingStore implements BillingStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcBillingStore.class);
    private static final int CONNECTION_CHECK_TIMEOUT_SECONDS = 5;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JdbcUpsertTarget<SurveyUnit> surveyUnits;
    private final JdbcUpsertTarget<BillRecord> bills;
    private final JdbcUpsertTarget<BillerContact> billerContacts;
    private volatile boolean postgreSql;

    public JdbcBillingStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.surveyUnits = new JdbcUpsertTarget<>(TargetTable.SURVEY_UNITS, true, surveyUnitColumns());
        this.bills = new JdbcUpsertTarget<>(TargetTable.BILLS, true, billColumns());
        this.billerContacts = new JdbcUpsertTarget<>(TargetTable.SURVEY_UNITS, false, billerContactColumns());
    }

    // billing contact and portal status columns keep their stored value when an export leaves them out
    private static List<Column<SurveyUnit>> surveyUnitColumns() {
        return List.of(
                Column.key("survey_id", SurveyUnit::surveyId),
                Column.overwrite("surveyor_name", SurveyUnit::surveyorName),
                Column.overwrite("survey_timestamp", unit -> timestamp(unit.surveyTimestamp())),
                Column.overwrite("city_district", SurveyUnit::cityDistrict),
                Column.overwrite("uc_name", SurveyUnit::ucName),
                Column.overwrite("unit_specific_type", SurveyUnit::businessType),
                Column.overwrite("survey_category", SurveyUnit::surveyCategory),
                Column.overwrite("survey_consumer_name", SurveyUnit::consumerName),
                Column.overwrite("survey_mobile", SurveyUnit::mobile),
                Column.overwrite("survey_address", SurveyUnit::address),
                Column.overwrite("gps_lat", SurveyUnit::gpsLat),
                Column.overwrite("gps_long", SurveyUnit::gpsLong),
                Column.keepWhenNull("billing_consumer_name", SurveyUnit::billingConsumerName),
                Column.keepWhenNull("billing_mobile", SurveyUnit::billingMobile),
                Column.keepWhenNull("billing_address", SurveyUnit::billingAddress),
                Column.keepWhenNull("is_active", SurveyUnit::active, "COALESCE(?, FALSE)")
        );
    }

    // ingested_at is written on insert only and keeps the first ingestion time
    private static List<Column<BillRecord>> billColumns() {
        return List.of(
                Column.key("psid", BillRecord::psid),
                Column.key("bill_month", BillRecord::billMonth),
                Column.overwrite("survey_id_fk", BillRecord::surveyIdFk),
                Column.overwrite("monthly_fee", BillRecord::monthlyFee),
                Column.overwrite("arrears", BillRecord::arrears),
                Column.overwrite("amount_due", BillRecord::amountDue),
                Column.overwrite("paid_amount", BillRecord::paidAmount),
                Column.overwrite("fine", BillRecord::fine),
                Column.overwrite("payment_status", bill -> bill.paymentStatus().name()),
                Column.overwrite("payment_date", bill -> date(bill.paymentDate())),
                Column.insertOnly("ingested_at", bill -> timestamp(bill.ingestedAt()))
        );
    }

    private static List<Column<BillerContact>> billerContactColumns() {
        return List.of(
                Column.key("survey_id", BillerContact::surveyId),
                Column.keepWhenNull("billing_consumer_name", BillerContact::consumerName),
                Column.keepWhenNull("billing_mobile", BillerContact::mobile),
                Column.keepWhenNull("billing_address", BillerContact::address),
                Column.keepWhenNull("is_active", BillerContact::activePortal)
        );
    }

    @PostConstruct
    public void initializeSchema() {
        postgreSql = isPostgreSql();
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS survey_units (
                    survey_id VARCHAR(64) PRIMARY KEY,
                    surveyor_name TEXT,
                    survey_timestamp TIMESTAMP,
                    city_district TEXT,
                    uc_name TEXT,
                    unit_specific_type TEXT,
                    survey_category TEXT,
                    survey_consumer_name TEXT,
                    survey_mobile TEXT,
                    survey_address TEXT,
                    billing_consumer_name TEXT,
                    billing_mobile TEXT,
                    billing_address TEXT,
                    gps_lat DOUBLE PRECISION,
                    gps_long DOUBLE PRECISION,
                    is_active BOOLEAN NOT NULL
                )
                """);
        ensureColumnExists("survey_units", "billing_consumer_name", "TEXT");
        ensureColumnExists("survey_units", "billing_mobile", "TEXT");
        ensureColumnExists("survey_units", "billing_address", "TEXT");
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS bills (
                    psid VARCHAR(64) NOT NULL,
                    bill_month VARCHAR(16) NOT NULL,
                    survey_id_fk VARCHAR(64) REFERENCES survey_units(survey_id),
                    monthly_fee NUMERIC(14, 2) NOT NULL,
                    arrears NUMERIC(14, 2) NOT NULL,
                    amount_due NUMERIC(14, 2) NOT NULL,
                    paid_amount NUMERIC(14, 2) NOT NULL,
                    fine NUMERIC(14, 2) NOT NULL,
                    payment_status VARCHAR(16) NOT NULL,
                    payment_date DATE,
                    ingested_at TIMESTAMP NOT NULL,
                    PRIMARY KEY (psid, bill_month)
                )
                """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_bills_survey_id_fk ON bills(survey_id_fk)");
        log.info("Billing schema ready (postgresql={})", postgreSql);
    }

    @Override
    public void verifyConnection() {
        Boolean valid = jdbcTemplate.execute(
                (ConnectionCallback<Boolean>) connection -> connection.isValid(CONNECTION_CHECK_TIMEOUT_SECONDS));
        if (!Boolean.TRUE.equals(valid)) {
            throw new DataAccessResourceFailureException("Database connection is not valid");
        }
    }

    @Override
    public Set<String> loadSurveyIds() {
        Set<String> ids = new HashSet<>();
        jdbcTemplate.query("SELECT survey_id FROM survey_units", rs -> {
            ids.add(rs.getString(1));
        });
        log.debug("Loaded {} survey ids", ids.size());
        return ids;
    }

    @Override
    public UpsertTarget<SurveyUnit> surveyUnits() {
        return surveyUnits;
    }

    @Override
    public UpsertTarget<BillRecord> bills() {
        return bills;
    }

    @Override
    public UpsertTarget<BillerContact> billerContacts() {
        return billerContacts;
    }

    @Override
    public long countRows(TargetTable table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table.tableName(), Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public long countActiveSurveyUnits() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM survey_units WHERE is_active = TRUE", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public long countBilledSurveyUnits() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(DISTINCT survey_id_fk) FROM bills WHERE survey_id_fk IS NOT NULL", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public Map<PaymentStatus, Long> countBillsByStatus() {
        Map<PaymentStatus, Long> counts = new EnumMap<>(PaymentStatus.class);
        for (PaymentStatus status : PaymentStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcTemplate.query("SELECT payment_status, COUNT(*) FROM bills GROUP BY payment_status", rs -> {
            String status = rs.getString(1);
            try {
                counts.put(PaymentStatus.valueOf(status.toUpperCase(Locale.ROOT)), rs.getLong(2));
            } catch (IllegalArgumentException ex) {
                log.warn("Ignoring bills with unexpected payment_status '{}'", status);
            }
        });
        return counts;
    }

    private void ensureColumnExists(String tableName, String columnName, String sqlType) {
        List<String> columns = jdbcTemplate.query("SELECT * FROM " + tableName + " WHERE 1 = 0", rs -> {
            ResultSetMetaData meta = rs.getMetaData();
            List<String> names = new ArrayList<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                names.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
            }
            return names;
        });
        if (columns != null && !columns.contains(columnName)) {
            jdbcTemplate.execute("ALTER TABLE " + tableName + " ADD COLUMN " + columnName + " " + sqlType);
            log.info("Added column {}.{}", tableName, columnName);
        }
    }

    private boolean isPostgreSql() {
        try (Connection connection = jdbcTemplate.getDataSource().getConnection()) {
            String productName = connection.getMetaData().getDatabaseProductName();
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgresql");
        } catch (SQLException ex) {
            throw new IllegalStateException("Unable to determine database product", ex);
        }
    }

    private static Timestamp timestamp(LocalDateTime value) {
        return value == null ? null : Timestamp.valueOf(value);
    }

    private static Timestamp timestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Date date(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }

    private enum ColumnMode {
        KEY,
        OVERWRITE,
        KEEP_WHEN_NULL,
        INSERT_ONLY
    }

    /**
     * One mapped column. {@code insertPlaceholder} is the SQL used for the value in an INSERT.
     */
    private record Column<T>(String name, ColumnMode mode, Function<T, Object> value, String insertPlaceholder) {

        static <T> Column<T> key(String name, Function<T, Object> value) {
            return new Column<>(name, ColumnMode.KEY, value, "?");
        }

        static <T> Column<T> overwrite(String name, Function<T, Object> value) {
            return new Column<>(name, ColumnMode.OVERWRITE, value, "?");
        }

        static <T> Column<T> keepWhenNull(String name, Function<T, Object> value) {
            return new Column<>(name, ColumnMode.KEEP_WHEN_NULL, value, "?");
        }

        static <T> Column<T> keepWhenNull(String name, Function<T, Object> value, String insertPlaceholder) {
            return new Column<>(name, ColumnMode.KEEP_WHEN_NULL, value, insertPlaceholder);
        }

        static <T> Column<T> insertOnly(String name, Function<T, Object> value) {
            return new Column<>(name, ColumnMode.INSERT_ONLY, value, "?");
        }

        boolean updatable() {
            return mode == ColumnMode.OVERWRITE || mode == ColumnMode.KEEP_WHEN_NULL;
        }

        String updateAssignment() {
            return mode == ColumnMode.KEEP_WHEN_NULL ? name + " = COALESCE(?, " + name + ")" : name + " = ?";
        }
    }

    /**
     * Column-driven upsert for one table. On PostgreSQL a batch is a single {@code INSERT ... ON CONFLICT}
     * statement; elsewhere it updates by key and inserts the rows the update did not touch. Either way the
     * batch runs inside one transaction. With {@code insertMissing} off, rows whose key is absent are
     * left alone.
     */
    private final class JdbcUpsertTarget<T> implements UpsertTarget<T> {

        private final TargetTable table;
        private final boolean insertMissing;
        private final List<Column<T>> columns;
        private final List<Column<T>> keyColumns;
        private final List<Column<T>> updatableColumns;
        private final List<Column<T>> keptColumns;
        private final String onConflictSql;
        private final String updateSql;
        private final String insertSql;

        private JdbcUpsertTarget(TargetTable table, boolean insertMissing, List<Column<T>> columns) {
            this.table = table;
            this.insertMissing = insertMissing;
            this.columns = columns;
            this.keyColumns = columns.stream().filter(column -> column.mode() == ColumnMode.KEY).toList();
            this.updatableColumns = columns.stream().filter(Column::updatable).toList();
            this.keptColumns = columns.stream().filter(column -> column.mode() == ColumnMode.KEEP_WHEN_NULL).toList();

            String tableName = table.tableName();
            this.insertSql = "INSERT INTO " + tableName + " ("
                    + columns.stream().map(Column::name).collect(Collectors.joining(", "))
                    + ") VALUES ("
                    + columns.stream().map(Column::insertPlaceholder).collect(Collectors.joining(", "))
                    + ")";
            this.onConflictSql = insertSql
                    + " ON CONFLICT (" + keyColumns.stream().map(Column::name).collect(Collectors.joining(", "))
                    + ") DO UPDATE SET "
                    + updatableColumns.stream()
                    .map(column -> column.mode() == ColumnMode.KEEP_WHEN_NULL
                            ? column.name() + " = COALESCE(?, " + tableName + "." + column.name() + ")"
                            : column.name() + " = EXCLUDED." + column.name())
                    .collect(Collectors.joining(", "));
            this.updateSql = "UPDATE " + tableName + " SET "
                    + updatableColumns.stream().map(Column::updateAssignment).collect(Collectors.joining(", "))
                    + " WHERE "
                    + keyColumns.stream().map(column -> column.name() + " = ?").collect(Collectors.joining(" AND "));
        }

        @Override
        public TargetTable table() {
            return table;
        }

        @Override
        public int upsertBatch(List<T> records) {
            if (records.isEmpty()) {
                return 0;
            }
            Integer written = transactionTemplate.execute(status -> {
                if (!insertMissing) {
                    return updateOnly(records);
                }
                return postgreSql ? upsertOnConflict(records) : updateThenInsert(records);
            });
            return written == null ? 0 : written;
        }

        private int upsertOnConflict(List<T> records) {
            List<Object[]> rows = new ArrayList<>(records.size());
            for (T record : records) {
                List<Object> values = values(columns, record);
                values.addAll(values(keptColumns, record));
                rows.add(values.toArray());
            }
            jdbcTemplate.batchUpdate(onConflictSql, rows);
            return records.size();
        }

        private int updateOnly(List<T> records) {
            int[] updated = jdbcTemplate.batchUpdate(updateSql, updateRows(records));
            return (int) Arrays.stream(updated).filter(count -> count != 0).count();
        }

        private int updateThenInsert(List<T> records) {
            int[] updated = jdbcTemplate.batchUpdate(updateSql, updateRows(records));

            // a key repeated inside one batch is inserted once, with its last values
            Map<List<Object>, T> inserts = new LinkedHashMap<>();
            for (int i = 0; i < records.size(); i++) {
                if (updated[i] == 0) {
                    T record = records.get(i);
                    inserts.put(values(keyColumns, record), record);
                }
            }
            if (!inserts.isEmpty()) {
                List<Object[]> rows = new ArrayList<>(inserts.size());
                for (T record : inserts.values()) {
                    rows.add(values(columns, record).toArray());
                }
                jdbcTemplate.batchUpdate(insertSql, rows);
            }
            return records.size();
        }

        private List<Object[]> updateRows(List<T> records) {
            List<Object[]> rows = new ArrayList<>(records.size());
            for (T record : records) {
                List<Object> values = values(updatableColumns, record);
                values.addAll(values(keyColumns, record));
                rows.add(values.toArray());
            }
            return rows;
        }

        private List<Object> values(List<Column<T>> selected, T record) {
            List<Object> values = new ArrayList<>(selected.size());
            for (Column<T> column : selected) {
                values.add(column.value().apply(record));
            }
            return values;
        }
    }
}
