package dustin.perp.domains.engine;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 거래 심볼 레지스트리
 * Symbol Registry
 * 
 * 역할:
 * - 서버 시작 시 설정(matching.symbols)으로 한 번 생성
 * - 매칭 엔진에 주입되어 심볼별 오더북 생성에 사용
 * - 런타임 심볼 추가는 지원하지 않음 (불변)
 */
public final class SymbolRegistry {

    private final Set<String> symbols;

    public SymbolRegistry(Collection<String> symbols) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String symbol : symbols) {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("Blank symbol in registry");
            }
            normalized.add(symbol.trim().toUpperCase(Locale.ROOT));
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one trading symbol is required");
        }
        this.symbols = Collections.unmodifiableSet(normalized);
    }

    public static SymbolRegistry of(String... symbols) {
        return new SymbolRegistry(Arrays.asList(symbols));
    }

    public boolean contains(String symbol) {
        return symbol != null && symbols.contains(symbol);
    }

    public Set<String> getSymbols() {
        return symbols;
    }

    public int size() {
        return symbols.size();
    }
}
