package in.sessiongate.broker;

import java.util.List;

public record AckResult(List<String> acknowledged, List<String> missing) {
}
