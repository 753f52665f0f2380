package com.mini.fts.plan;

import com.mini.fts.format.ColumnarFileReader;
import com.mini.fts.predicate.Predicate;
import com.mini.fts.schema.Row;
import com.mini.fts.schema.Schema;
import com.mini.fts.store.IndexedFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 按计划执行宿主文件扫描
 * 短路计划不读取任何数据；其余计划先按扫描谓词剪枝，再逐行应用残留过滤
 */
public class ScanExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ScanExecutor.class);
    
    private final PlanSelector planSelector;
    
    public ScanExecutor(PlanSelector planSelector) {
        this.planSelector = planSelector;
    }
    
    /**
     * 选择计划并执行
     */
    public List<Row> scan(IndexedFileReader file, Predicate predicate) throws IOException {
        return execute(file.getFileReader(), planSelector.select(file, predicate));
    }
    
    public List<Row> execute(ColumnarFileReader reader, ScanPlan plan) throws IOException {
        if (plan.isShortCircuitEmpty()) {
            logger.debug("Short-circuited scan of {}", reader.getPath());
            return Collections.emptyList();
        }
        
        Predicate scanPredicate = plan.getScanPredicate();
        List<Row> rows = reader.read(scanPredicate);
        
        Predicate residual = plan.getResidualPredicate();
        if (residual == null || residual == scanPredicate) {
            return rows;
        }
        Schema schema = reader.getSchema();
        List<Row> result = new ArrayList<>(rows.size());
        for (Row row : rows) {
            if (residual.test(row, schema)) {
                result.add(row);
            }
        }
        logger.debug("Residual filter kept {} of {} rows", result.size(), rows.size());
        return result;
    }
}
