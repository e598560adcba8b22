package cex.spot.matching.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * MyBatis configuration class
 * Mapper XML locations and enum type handlers are set in application.yml
 */
@Configuration
@MapperScan("cex.spot.matching.mapper")
@EnableTransactionManagement
public class MyBatisConfig {
}
