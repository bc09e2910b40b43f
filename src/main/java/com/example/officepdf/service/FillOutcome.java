package com.example.officepdf.service;

import com.example.officepdf.expression.TokenExpression;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class FillOutcome {
    Map<TokenExpression, String> values;
    List<String> warnings;
}
