package org.fpbeditor.common;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Reads model fields that are written either in camel case ({@code sourceId}) or in the snake
 * case of the editor's parser output ({@code source_ref}). The first name wins if both are set.
 */
final class JsonFields {

  private JsonFields() {}

  static String getString(JSONObject json, String key, String alias) throws JSONException {
    return json.has(key) ? json.getString(key) : json.getString(alias);
  }

  static String optString(JSONObject json, String key, String alias) {
    String value = optString(json, key);
    return (value != null) ? value : optString(json, alias);
  }

  /**
   * @return the value, or null if the field is missing or JSON null.
   */
  static String optString(JSONObject json, String key) {
    return json.isNull(key) ? null : json.optString(key, null);
  }

  static JSONArray optJSONArray(JSONObject json, String key, String alias) {
    JSONArray array = json.optJSONArray(key);
    return (array != null) ? array : json.optJSONArray(alias);
  }
}
