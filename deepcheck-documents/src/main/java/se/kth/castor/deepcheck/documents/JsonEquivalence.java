package se.kth.castor.deepcheck.documents;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON documents must hold exactly one value. Empty input and trailing content are malformed.
 */
public class JsonEquivalence extends DocumentEquivalence {

  public JsonEquivalence() {
    super(JsonMapper.builder().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).build());
  }

  @Override
  protected boolean acceptsEmptyDocument() {
    return false;
  }
}
