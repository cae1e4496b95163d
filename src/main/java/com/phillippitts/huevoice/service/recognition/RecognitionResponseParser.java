package com.phillippitts.huevoice.service.recognition;

import com.phillippitts.huevoice.exception.RecognitionException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the streaming speech API response: one JSON object per line, the first usually an empty
 * {@code {"result":[]}}, then
 * <pre>
 * {"result":[{"alternative":[{"transcript":"turn on the lights","confidence":0.92},
 *                            {"transcript":"turn on the light"}],"final":true}],"result_index":0}
 * </pre>
 *
 * <p>Only the first line carrying alternatives is used. A missing {@code confidence} reads as 1.0.
 */
final class RecognitionResponseParser {

    static final double DEFAULT_CONFIDENCE = 1.0;

    private RecognitionResponseParser() {
    }

    static RecognitionResponse parse(String body) {
        if (body == null || body.isBlank()) {
            throw new RecognitionException("Empty recognition response", RecognitionException.Reason.NOT_UNDERSTOOD);
        }
        try {
            for (String line : body.split("\\R")) {
                if (line.isBlank()) {
                    continue;
                }
                JSONArray results = new JSONObject(line).optJSONArray("result");
                if (results == null || results.isEmpty()) {
                    continue;
                }
                List<RecognitionResponse.Alternative> alternatives = alternatives(results.getJSONObject(0));
                if (!alternatives.isEmpty()) {
                    return new RecognitionResponse(alternatives);
                }
            }
        } catch (JSONException e) {
            throw new RecognitionException("Unparseable recognition response",
                    RecognitionException.Reason.MALFORMED_RESPONSE, e);
        }
        throw new RecognitionException("No speech recognized", RecognitionException.Reason.NOT_UNDERSTOOD);
    }

    private static List<RecognitionResponse.Alternative> alternatives(JSONObject result) {
        JSONArray array = result.optJSONArray("alternative");
        List<RecognitionResponse.Alternative> list = new ArrayList<>();
        if (array == null) {
            return list;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject alt = array.getJSONObject(i);
            String text = alt.optString("transcript", "").trim();
            if (text.isEmpty()) {
                continue;
            }
            double confidence = alt.optDouble("confidence", DEFAULT_CONFIDENCE);
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new JSONException("confidence out of range: " + alt.opt("confidence"));
            }
            list.add(new RecognitionResponse.Alternative(text, confidence));
        }
        return list;
    }
}
