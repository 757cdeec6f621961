package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.domain.type.BuildingType;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameActionType;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameCommand;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 클라이언트가 보낸 (액션 이름, payload) 를 타입이 정해진 GameCommand 로 바꾼다.
 * 형식이 틀리면 게임 상태를 건드리기 전에 INVALID_PAYLOAD 로 거절한다.
 */
@Component
public class GameActionParser {

    public GameCommand parse(String actionName, JsonNode payload) {
        GameActionType type = GameActionType.fromActionName(actionName)
                .orElseThrow(() -> new GameRuleException(ErrorCode.UNKNOWN_ACTION, String.valueOf(actionName)));

        JsonNode body = (payload == null || payload.isNull()) ? JsonNodeFactory.instance.objectNode() : payload;
        if (!body.isObject()) {
            throw new GameRuleException(ErrorCode.INVALID_PAYLOAD, "payload must be an object");
        }

        return switch (type) {
            case PLAY_LAND -> new GameCommand.PlayLand(requireInt(body, "index"));
            case CLAIM_GIFT -> new GameCommand.ClaimGift(requireText(body, "gift_id"));
            case STEAL_GIFT -> new GameCommand.StealGift(
                    requireText(body, "gift_id"),
                    optionalBoolean(body, "add_lock"),
                    optionalIntList(body, "discard_indices"));
            case WRAP_GIFT -> new GameCommand.WrapGift(requireText(body, "gift_id"));
            case BUILD_BUILDING -> new GameCommand.BuildBuilding(requireBuilding(body));
            case RECYCLE -> new GameCommand.Recycle();
            case DISCARD -> new GameCommand.Discard(requireInt(body, "index"));
            case END_TURN -> new GameCommand.EndTurn();
        };
    }

    private int requireInt(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (!isInt(node)) {
            throw new GameRuleException(ErrorCode.INVALID_PAYLOAD, field + " must be an integer");
        }
        return node.intValue();
    }

    private String requireText(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || !node.isTextual() || !StringUtils.hasText(node.textValue())) {
            throw new GameRuleException(ErrorCode.INVALID_PAYLOAD, field + " is required");
        }
        return node.textValue();
    }

    private boolean optionalBoolean(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return false;
        }
        if (!node.isBoolean()) {
            throw new GameRuleException(ErrorCode.INVALID_PAYLOAD, field + " must be a boolean");
        }
        return node.booleanValue();
    }

    private List<Integer> optionalIntList(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new GameRuleException(ErrorCode.INVALID_PAYLOAD, field + " must be a list");
        }

        List<Integer> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!isInt(element)) {
                throw new GameRuleException(ErrorCode.INVALID_PAYLOAD, field + " must contain integers");
            }
            values.add(element.intValue());
        }
        return List.copyOf(values);
    }

    private BuildingType requireBuilding(JsonNode body) {
        String code = requireText(body, "building");
        return BuildingType.fromCode(code)
                .orElseThrow(() -> new GameRuleException(ErrorCode.UNKNOWN_BUILDING, code));
    }

    private boolean isInt(JsonNode node) {
        return node != null && node.isIntegralNumber() && node.canConvertToInt();
    }
}
