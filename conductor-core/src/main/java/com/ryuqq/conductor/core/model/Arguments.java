package com.ryuqq.conductor.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.conductor.core.json.JsonSupport;

import java.util.Map;
import java.util.Optional;

/**
 * 액션 인자 컨테이너.
 *
 * <p>자유 형식 인자 맵을 JSON 트리(문자열/숫자/불리언/배열/객체의 태그드 유니온)로
 * 보관하여 유연성을 유지하면서 경계에서 타입 안전성을 잃지 않도록 합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Arguments.of(Map.of("table", "invoices", "limit", 50))</li>
 *   <li>Arguments.empty() - 인자 없음</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시 방어적 복사, 조회 시 복사본 반환</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Arguments {

    private static final Arguments EMPTY = new Arguments(JsonSupport.newObject());

    private final ObjectNode values;

    private Arguments(ObjectNode values) {
        this.values = values;
    }

    /**
     * Map으로부터 Arguments 생성.
     *
     * @param values 인자 맵 (null이면 빈 Arguments)
     * @return Arguments 인스턴스
     * @throws IllegalArgumentException JSON으로 표현할 수 없는 값이 포함된 경우
     */
    public static Arguments of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new Arguments((ObjectNode) JsonSupport.toTree(values));
    }

    /**
     * JSON 객체 노드로부터 Arguments 생성.
     *
     * @param node JSON 객체 (null이면 빈 Arguments)
     * @return Arguments 인스턴스
     * @throws IllegalArgumentException node가 객체가 아닌 경우
     */
    public static Arguments of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("arguments must be a JSON object, but was: " + node.getNodeType());
        }
        return new Arguments(((ObjectNode) node).deepCopy());
    }

    /**
     * 빈 Arguments.
     *
     * @return 빈 Arguments 인스턴스
     */
    public static Arguments empty() {
        return EMPTY;
    }

    /**
     * 인자 값 조회.
     *
     * @param name 인자 이름
     * @return 값 노드, 없으면 empty
     */
    public Optional<JsonNode> get(String name) {
        JsonNode node = values.get(name);
        return node == null ? Optional.empty() : Optional.of(node.deepCopy());
    }

    /**
     * 문자열 인자 조회.
     *
     * @param name 인자 이름
     * @return 문자열 값, 없거나 문자열이 아니면 empty
     */
    public Optional<String> getString(String name) {
        JsonNode node = values.get(name);
        return node != null && node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
    }

    /**
     * 인자 존재 여부.
     *
     * @param name 인자 이름
     * @return 존재하면 true
     */
    public boolean contains(String name) {
        return values.has(name);
    }

    /**
     * 비어있는지 확인.
     *
     * @return 인자가 없으면 true
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * JSON 트리 복사본 조회.
     *
     * @return 인자 객체의 복사본
     */
    public ObjectNode asJson() {
        return values.deepCopy();
    }

    /**
     * 일반 Map 형태로 변환 (감사 로그 상세용).
     *
     * @return 새 Map 인스턴스
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> asMap() {
        return JsonSupport.mapper().convertValue(values, Map.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Arguments that = (Arguments) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Arguments{" + values.size() + " entries}";
    }
}
