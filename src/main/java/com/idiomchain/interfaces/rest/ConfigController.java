package com.idiomchain.interfaces.rest;

import com.idiomchain.application.IdiomQueryService;
import com.idiomchain.application.port.IdiomDictionary;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final IdiomDictionary dict;
  private final IdiomQueryService queries;

  public ConfigController(IdiomDictionary dict, IdiomQueryService queries) {
    this.dict = dict;
    this.queries = queries;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    Map<String, Object> out = new LinkedHashMap<>();
    boolean ready = dict.isReady();
    out.put("ready", ready);
    out.put("idiomCount", ready ? dict.size() : 0);
    out.put("pathStrategy", ready ? dict.pathStrategy().name() : null);
    out.put("defaultLength", queries.defaultLength());
    out.put("protocolVersion", 1);
    return out;
  }
}
