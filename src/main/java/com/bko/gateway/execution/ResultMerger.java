package com.bko.gateway.execution;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Additive merge of partial results into the response tree. Keys missing from the target are
 * added, nested objects are merged recursively and lists are merged element by element.
 * A value already present in the target is never replaced, so merging the same object twice
 * leaves the tree as merging it once.
 */
@Component
public class ResultMerger {

    public void merge(Map<String, Object> target, Map<String, ?> incoming) {
        if (incoming == null) {
            return;
        }
        for (Map.Entry<String, ?> entry : incoming.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (!target.containsKey(key)) {
                target.put(key, copy(value));
                continue;
            }
            mergeValue(target.get(key), value);
        }
    }

    private void mergeValue(Object existing, Object incoming) {
        if (existing instanceof Map<?, ?> existingMap && incoming instanceof Map<?, ?> incomingMap) {
            merge(asObject(existingMap), asObject(incomingMap));
        } else if (existing instanceof List<?> existingList && incoming instanceof List<?> incomingList) {
            int shared = Math.min(existingList.size(), incomingList.size());
            for (int i = 0; i < shared; i++) {
                mergeValue(existingList.get(i), incomingList.get(i));
            }
        }
    }

    /**
     * Deep copy into mutable containers so that later merges can extend what was written.
     */
    static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copied = new LinkedHashMap<>(map.size());
            map.forEach((key, nested) -> copied.put((String) key, copy(nested)));
            return copied;
        }
        if (value instanceof List<?> list) {
            List<Object> copied = new ArrayList<>(list.size());
            for (Object element : list) {
                copied.add(copy(element));
            }
            return copied;
        }
        return value;
    }

    /**
     * Views a JSON object of the response tree. Objects always carry field names as keys.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> asObject(Object value) {
        return (Map<String, Object>) value;
    }
}
