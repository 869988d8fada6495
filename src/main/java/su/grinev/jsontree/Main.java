package su.grinev.jsontree;

import su.grinev.jsontree.json.JsonReader;
import su.grinev.jsontree.json.value.JsonObject;
import su.grinev.jsontree.json.value.JsonValue;

public class Main {

    private static final String EXAMPLE = """
            {
                "name": "json-tree",
                "version": 1.0,
                "stable": false,
                "license": null,
                "tags": ["parser", "tokenizer", "json"],
                "limits": {"maxDepth": 512, "strictLiterals": true},
                "greeting": "hello\\tworld\\n"
            }
            """;

    public static void main(String[] args) {
        JsonReader reader = new JsonReader();
        JsonObject document = reader.readObject(EXAMPLE);

        System.out.println(document);
        for (String key : document.members().keySet()) {
            JsonValue value = document.get(key);
            System.out.println("%s (%s): %s".formatted(key, value.type(), value));
        }
        System.out.println("limits.maxDepth = %s".formatted(document.find("limits.maxDepth").asNumber()));
    }
}
