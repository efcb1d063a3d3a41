package mgnrega.tracker.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import jakarta.annotation.PostConstruct;

@Configuration
public class MongoConfig {

    private final MongoTemplate mongoTemplate;

    @Autowired
    public MongoConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @PostConstruct
    public void initIndexes() {
        // Districts: one row per (state, bilingual name)
        mongoTemplate.indexOps("districts").ensureIndex(new Index()
                .on("stateCode", Sort.Direction.ASC)
                .on("districtName", Sort.Direction.ASC)
                .unique()
                .named("state_district_unique"));
        mongoTemplate.indexOps("districts").ensureIndex(new Index().on("stateCode", Sort.Direction.ASC));

        // Performance: at most one row per district per month
        mongoTemplate.indexOps("performance").ensureIndex(new Index()
                .on("stateCode", Sort.Direction.ASC)
                .on("districtName", Sort.Direction.ASC)
                .on("dataMonth", Sort.Direction.ASC)
                .unique()
                .named("state_district_month_unique"));
        // Serves the latest-month lookup
        mongoTemplate.indexOps("performance").ensureIndex(new Index()
                .on("stateCode", Sort.Direction.ASC)
                .on("districtName", Sort.Direction.ASC)
                .on("dataMonth", Sort.Direction.DESC)
                .named("state_district_month_desc"));
        mongoTemplate.indexOps("performance").ensureIndex(new Index()
                .on("stateCode", Sort.Direction.ASC)
                .on("dataMonth", Sort.Direction.ASC));

        mongoTemplate.indexOps("api_logs").ensureIndex(new Index().on("endpoint", Sort.Direction.ASC));
        mongoTemplate.indexOps("api_logs").ensureIndex(new Index().on("createdAt", Sort.Direction.DESC));

        mongoTemplate.indexOps("sync_logs").ensureIndex(new Index().on("status", Sort.Direction.ASC));
        mongoTemplate.indexOps("sync_logs").ensureIndex(new Index().on("startedAt", Sort.Direction.DESC));
    }
}
