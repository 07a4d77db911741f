package com.example.storage.temporal;

import com.example.storage.error.RecordNotFoundException;
import com.example.storage.model.AuditEntry;
import com.example.storage.model.AuditOperation;
import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.LogicalType;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;
import com.example.storage.model.VersionedRecord;
import com.example.storage.schema.SchemaManager;
import com.example.storage.schema.TemporalSchema;
import com.example.storage.sql.QueryBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
public class CopyOnChangeRepositoryIntegrationTest {

    private static final UUID ACTOR = UUID.fromString("2b7e1516-0000-4000-8000-0000000000aa");

    private static final TableDefinition PRODUCTS = TableDefinition.builder()
            .schema("coc_test")
            .name("products")
            .strategy(TemporalStrategyType.COPY_ON_CHANGE)
            .softDelete(true)
            .column(ColumnDefinition.builder().name("name").type(LogicalType.STRING).maxLength(120)
                    .nullable(false).build())
            .column(ColumnDefinition.builder().name("price").type(LogicalType.DECIMAL)
                    .precision(10).scale(2).build())
            .column(ColumnDefinition.of("attributes", LogicalType.JSON))
            .build();

    @Autowired
    private SchemaManager schemaManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private QueryBuilder queryBuilder;

    private MutableClock clock;
    private TemporalRepository products;

    @BeforeEach
    public void setUp() {
        schemaManager.syncSchema(List.of(PRODUCTS), false, false);
        clock = new MutableClock(Instant.parse("2024-06-01T09:00:00Z"));
        products = new TemporalRepositoryFactory(RepositoryContext.builder()
                .jdbcTemplate(jdbcTemplate)
                .transactionManager(transactionManager)
                .queryBuilder(queryBuilder)
                .temporalSchema(new TemporalSchema())
                .clock(clock)
                .build())
                .create(PRODUCTS);
    }

    private VersionedRecord createWidget() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "Widget");
        data.put("price", new BigDecimal("19.99"));
        return products.create(data, ACTOR);
    }

    @Test
    public void testInsertThenPriceChangeIsAudited() {
        VersionedRecord created = createWidget();

        List<AuditEntry> afterInsert = products.getAuditHistory(created.getId());
        assertThat(afterInsert).hasSize(2);
        assertThat(afterInsert).extracting(AuditEntry::getFieldName).containsExactly("name", "price");
        assertThat(afterInsert).allSatisfy(entry -> {
            assertThat(entry.getOperation()).isEqualTo(AuditOperation.INSERT);
            assertThat(entry.getOldValue()).isNull();
            assertThat(entry.getChangedBy()).isEqualTo(ACTOR);
            assertThat(entry.getTransactionId()).isEqualTo(afterInsert.get(0).getTransactionId());
        });

        clock.advance(Duration.ofMinutes(10));
        VersionedRecord updated = products.update(created.getId(),
                Map.of("name", "Widget", "price", new BigDecimal("24.99")), ACTOR);

        assertThat(updated.get("price")).isEqualTo(new BigDecimal("24.99"));
        assertThat(updated.getUpdatedAt()).isEqualTo(Instant.parse("2024-06-01T09:10:00Z"));
        assertThat(updated.getCreatedAt()).isEqualTo(created.getCreatedAt());

        List<AuditEntry> history = products.getAuditHistory(created.getId());
        assertThat(history).hasSize(3);
        AuditEntry priceChange = history.get(2);
        assertThat(priceChange.getOperation()).isEqualTo(AuditOperation.UPDATE);
        assertThat(priceChange.getFieldName()).isEqualTo("price");
        assertThat(priceChange.getOldValue()).isEqualTo(19.99d);
        assertThat(priceChange.getNewValue()).isEqualTo(24.99d);
        assertThat(priceChange.getChangedAt()).isEqualTo(Instant.parse("2024-06-01T09:10:00Z"));

        assertThat(products.getFieldHistory(created.getId(), "price"))
                .extracting(AuditEntry::getOperation)
                .containsExactly(AuditOperation.INSERT, AuditOperation.UPDATE);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM coc_test.products WHERE id = ?",
                Long.class, created.getId())).isEqualTo(1);
    }

    @Test
    public void testUnchangedValuesWriteNoAudit() {
        VersionedRecord created = createWidget();

        products.update(created.getId(), Map.of("price", new BigDecimal("19.990")), ACTOR);

        assertThat(products.getAuditHistory(created.getId())).hasSize(2);
    }

    @Test
    public void testJsonFieldRoundTripsAndIsAudited() {
        VersionedRecord created = createWidget();

        VersionedRecord updated = products.update(created.getId(),
                Map.of("attributes", Map.of("color", "red", "sizes", List.of("S", "M"))), ACTOR);

        assertThat(updated.get("attributes")).isEqualTo(Map.of("color", "red", "sizes", List.of("S", "M")));
        assertThat(products.getFieldHistory(created.getId(), "attributes"))
                .singleElement()
                .satisfies(entry -> assertThat(entry.getNewValue()).isEqualTo(updated.get("attributes")));
    }

    @Test
    public void testSoftDeleteAndRestoreAreAudited() {
        VersionedRecord created = createWidget();
        clock.advance(Duration.ofMinutes(1));

        assertThat(products.delete(created.getId(), ACTOR)).isTrue();
        assertThat(products.delete(created.getId(), ACTOR)).isFalse();
        assertThat(products.get(created.getId())).isEmpty();
        assertThat(products.list(Map.of("name", "Widget"), null, 0, true))
                .extracting(VersionedRecord::getId).contains(created.getId());

        clock.advance(Duration.ofMinutes(1));
        VersionedRecord restored = products.restore(created.getId(), ACTOR);
        assertThat(restored.isDeleted()).isFalse();
        assertThat(restored.getDeletedBy()).isNull();

        List<AuditEntry> history = products.getFieldHistory(created.getId(), TemporalSchema.DELETED_AT);
        assertThat(history).extracting(AuditEntry::getOperation)
                .containsExactly(AuditOperation.DELETE, AuditOperation.UPDATE);
        assertThat(history.get(0).getOldValue()).isNull();
        assertThat(history.get(0).getNewValue()).isEqualTo("2024-06-01T09:01:00Z");
        assertThat(history.get(1).getOldValue()).isEqualTo("2024-06-01T09:01:00Z");
        assertThat(history.get(1).getNewValue()).isNull();
    }

    @Test
    public void testRestoreOfLiveRecordChangesNothing() {
        VersionedRecord created = createWidget();

        VersionedRecord restored = products.restore(created.getId(), ACTOR);

        assertThat(restored).isEqualTo(created);
        assertThat(products.getAuditHistory(created.getId())).hasSize(2);
        assertThatThrownBy(() -> products.restore(UUID.randomUUID(), ACTOR))
                .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    public void testHardDeleteKeepsTheAuditTrail() {
        VersionedRecord created = createWidget();
        clock.advance(Duration.ofSeconds(1));

        assertThat(products.delete(created.getId(), ACTOR, true)).isTrue();

        assertThat(products.get(created.getId(), null, true)).isEmpty();
        List<AuditEntry> history = products.getAuditHistory(created.getId());
        assertThat(history).hasSize(3);
        AuditEntry last = history.get(2);
        assertThat(last.getOperation()).isEqualTo(AuditOperation.DELETE);
        assertThat(last.getFieldName()).isEqualTo(TemporalSchema.ID);
        assertThat(last.getOldValue()).isEqualTo(created.getId().toString());
        assertThat(last.getNewValue()).isNull();
    }

    @Test
    public void testVersionReadsAreNotSupported() {
        VersionedRecord created = createWidget();

        assertThatThrownBy(() -> products.getVersionHistory(created.getId()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> products.get(created.getId(), Instant.now(), false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testAuditUsesDeclaredColumnNames() {
        VersionedRecord created = products.create(Map.of("NAME", "Gadget", "Price", new BigDecimal("5.00")), ACTOR);
        clock.advance(Duration.ofMinutes(1));
        products.update(created.getId(), Map.of("PRICE", new BigDecimal("6.00")), ACTOR);

        assertThat(products.getAuditHistory(created.getId())).extracting(AuditEntry::getFieldName)
                .containsExactly("name", "price", "price");
        assertThat(products.getFieldHistory(created.getId(), "price"))
                .extracting(AuditEntry::getOperation)
                .containsExactly(AuditOperation.INSERT, AuditOperation.UPDATE);
    }
}
