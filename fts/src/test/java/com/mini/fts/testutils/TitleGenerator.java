package com.mini.fts.testutils;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 生成合成标题的测试数据源，固定种子保证可重复
 * 
 * 标题混合大小写、标点和数字，用于检验分词与子串匹配之间的差异。
 */
public class TitleGenerator {
    
    private static final String[] WORDS = {
        "dairy", "cow", "Cow", "DAIRY", "farm", "farmer", "milk", "milking", "cowboy", "scow",
        "herd", "barn", "hay", "grazing", "pasture", "cattle", "calf", "calves", "bull", "butter",
        "cheese", "yogurt", "tractor", "field", "fields", "spring", "summer", "harvest", "village", "market"
    };
    
    private static final String[] SEPARATORS = {" ", " ", " ", ", ", "-", " - ", "'s ", "/", "  "};
    
    private static final String[] SUFFIXES = {"", "", "", "!", "?", ".", " 2024", " (vol. 3)", " #7"};
    
    private final Random random;
    
    public TitleGenerator(long seed) {
        this.random = new Random(seed);
    }
    
    public String next() {
        int words = 1 + random.nextInt(6);
        StringBuilder title = new StringBuilder();
        for (int i = 0; i < words; i++) {
            if (i > 0) {
                title.append(SEPARATORS[random.nextInt(SEPARATORS.length)]);
            }
            title.append(WORDS[random.nextInt(WORDS.length)]);
        }
        title.append(SUFFIXES[random.nextInt(SUFFIXES.length)]);
        return title.toString();
    }
    
    public List<String> next(int count) {
        List<String> titles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            titles.add(next());
        }
        return titles;
    }
    
    /**
     * 从已有标题中随机截取一段作为子串模式，截取位置不考虑词边界
     */
    public String substringOf(String title) {
        int start = random.nextInt(title.length());
        int end = start + 1 + random.nextInt(Math.min(12, title.length() - start));
        return title.substring(start, end);
    }
}
