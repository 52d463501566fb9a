package com.chambua.pricing.service;

import com.chambua.pricing.dto.PriceListRow;
import com.chambua.pricing.dto.SearchHitDTO;
import com.chambua.pricing.dto.SearchPageDTO;
import com.chambua.pricing.dto.StartUploadRequest;
import com.chambua.pricing.dto.UploadJobResult;
import com.chambua.pricing.repository.SearchIndexEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CatalogSearchIntegrationTest {

    @Autowired private PriceUploadCoordinator coordinator;
    @Autowired private CatalogSearchService searchService;
    @Autowired private SearchIndexEntryRepository indexRepository;
    @Autowired private JdbcTemplate jdbcTemplate;

    private UploadJobResult first;

    @BeforeEach
    void seedCatalog() {
        jdbcTemplate.update("delete from catalog_search_index");
        jdbcTemplate.update("delete from upload_failure");
        jdbcTemplate.update("delete from price_history");
        jdbcTemplate.update("delete from catalog_product");
        jdbcTemplate.update("delete from upload_job");

        first = upload(
                named("A", "4200", "Dior > Sauvage > Sauvage Eau de Toilette 100 ml"),
                named("B", "9100", "Chanel Coco Mademoiselle парфюмированная вода 50 мл"),
                named("C", "7300", "Dior J'adore 50 ml"));
    }

    private UploadJobResult upload(PriceListRow... rows) {
        return coordinator.runNow(new StartUploadRequest("prices.csv", LocalDate.of(2024, 4, 1), List.of(rows)), "tester");
    }

    private static PriceListRow named(String externalId, String price, String rawName) {
        return new PriceListRow(externalId, new BigDecimal(price), null, null, true, rawName);
    }

    @Test
    void everyTokenMustMatch() {
        SearchPageDTO dior = searchService.search("dior", null, 0, 50);
        assertThat(dior.total()).isEqualTo(2);
        // newest product first
        assertThat(dior.items()).extracting(SearchHitDTO::externalId).containsExactly("C", "A");

        SearchPageDTO sauvage = searchService.search("DIOR, sauvage", null, 0, 50);
        assertThat(sauvage.items()).singleElement().satisfies(hit -> {
            assertThat(hit.externalId()).isEqualTo("A");
            assertThat(hit.brand()).isEqualTo("Dior");
            assertThat(hit.quotedPrice()).isEqualByComparingTo("4500");
        });
    }

    @Test
    void nonLatinTextAndArticleAreSearchable() {
        assertThat(searchService.search("парфюмированная", null, 0, 50).items())
                .extracting(SearchHitDTO::externalId).containsExactly("B");
        assertThat(searchService.search("b", null, 0, 50).items())
                .extracting(SearchHitDTO::externalId).containsExactly("B");
    }

    @Test
    void likeWildcardsAreLiteral() {
        assertThat(searchService.search("%", null, 0, 50).total()).isZero();
        assertThat(searchService.search("_", null, 0, 50).total()).isZero();
    }

    @Test
    void removedProductsLeaveTheIndexInTheSameUpload() {
        UploadJobResult second = upload(
                named("A", "4200", "Dior > Sauvage > Sauvage Eau de Toilette 100 ml"),
                named("B", "9100", "Chanel Coco Mademoiselle парфюмированная вода 50 мл"),
                named("D", "5100", "Dior Homme 100 ml"));

        assertThat(second.removedCount()).isEqualTo(1);
        assertThat(searchService.search("j'adore", null, 0, 50).total()).isZero();
        assertThat(indexRepository.count()).isEqualTo(3);

        assertThat(searchService.search("dior", second.jobId(), 0, 50).items())
                .extracting(SearchHitDTO::externalId).containsExactly("D", "A");
        assertThat(searchService.search("dior", first.jobId(), 0, 50).items())
                .extracting(SearchHitDTO::externalId).containsExactly("A");
    }

    @Test
    void rebuildRestoresTheProjection() throws Exception {
        jdbcTemplate.update("delete from catalog_search_index");
        assertThat(searchService.search("dior", null, 0, 50).total()).isZero();

        long indexed = coordinator.rebuildSearchIndex().get(10, TimeUnit.SECONDS);

        assertThat(indexed).isEqualTo(3);
        assertThat(searchService.search("dior", null, 0, 50).total()).isEqualTo(2);
    }

    @Test
    void pageSizeIsClamped() {
        assertThat(searchService.search(null, null, 0, 1000).size()).isEqualTo(100);
        SearchPageDTO tiny = searchService.search(null, null, 0, 0);
        assertThat(tiny.size()).isEqualTo(1);
        assertThat(tiny.items()).hasSize(1);
        assertThat(tiny.total()).isEqualTo(3);
    }
}
