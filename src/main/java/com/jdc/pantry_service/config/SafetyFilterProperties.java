package com.jdc.pantry_service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 콘텐츠 안전 필터 규칙. 운영 환경에서는 application.yml 로 덮어쓴다.
 */
@Configuration
@ConfigurationProperties(prefix = "pantry.safety")
@Getter @Setter
public class SafetyFilterProperties {

    private List<String> blockedTerms = new ArrayList<>(List.of(
            // 사람
            "human", "person", "people", "baby", "child", "man", "woman", "flesh",
            "body", "corpse", "blood", "organs", "brain",
            // 반려동물
            "dog", "cat", "puppy", "kitten", "pet",
            // 멸종위기/보호종
            "endangered", "protected species",
            "elephant", "tiger", "lion", "whale", "dolphin", "seal", "panda",
            "gorilla", "chimpanzee", "orangutan", "monkey", "ape",
            // 독극물
            "poison", "toxic", "cyanide", "arsenic", "bleach", "detergent",
            "rat poison", "pesticide", "antifreeze",
            // 비식용
            "plastic", "metal", "glass", "paper", "cardboard", "dirt", "mud",
            "rock", "stone", "wood", "gasoline",
            // 위험물
            "drug", "marijuana", "cocaine", "heroin", "meth", "narcotic",
            "explosive", "gunpowder", "ammunition",
            // 벌레
            "maggot", "worm", "cockroach", "fly", "mosquito", "spider",
            // 분비물
            "urine", "feces", "vomit", "pus", "mucus", "saliva", "spit",
            // 의료
            "fetus", "placenta", "abortion",
            // 요리와 무관한 유해 요청
            "violence", "kill", "weapon", "cannibalism", "nsfw", "adult content",
            // 개인정보
            "ssn", "credit card", "password"
    ));

    private List<String> blockedPatterns = new ArrayList<>(List.of(
            "\\bhuman\\s+meat\\b",
            "\\beat(ing)?\\s+humans?\\b",
            "\\b(pet|dog|cat|horse)\\s+meat\\b",
            "\\b(motor|engine|machine)\\s+oil\\b",
            "\\b(cook|roast|grill|fry|boil|eat)\\s+(a\\s+|my\\s+|the\\s+)?(neighbou?r|friend|roommate|wife|husband)\\b"
    ));

    /**
     * 차단까지는 아니지만 다룰 수 없는 식재료 요청. 오류 대신 안내 레시피로 응답한다.
     */
    private List<String> restrictedItems = new ArrayList<>(List.of(
            "protected", "illegal to hunt", "banned substance", "controlled substance",
            "poisonous mushroom", "illegal food"
    ));

    private List<String> restrictedPatterns = new ArrayList<>(List.of(
            "\\bprotected\\s+.*\\s+cook",
            "\\billegal\\s+.*\\s+food",
            "\\bbanned\\s+.*\\s+ingredient"
    ));

    private List<String> exceptionPhrases = new ArrayList<>(List.of(
            "humanely raised", "human grade", "humane",
            "dogfish", "catnip", "hot dog", "corn dog", "hush puppy", "hush puppies",
            "tiger prawn", "tiger shrimp", "tiger bread",
            "lion's mane", "monkey bread", "elephant ear", "bear claw", "pig's ear",
            "baby spinach", "baby carrot", "baby corn", "baby potato", "baby potatoes", "baby back ribs",
            "blood orange", "rock salt", "rock candy", "stone fruit", "stone ground", "stone-ground",
            "glass noodles", "rice paper", "parchment paper", "wood ear",
            "mud pie", "mud cake", "dirt cake", "gummy worm", "spider roll", "spider crab",
            "blood sausage", "spit-roast", "spit-roasted", "full-bodied",
            // 조리 도구 (레시피 본문에 자주 등장)
            "paper towel", "paper towels", "baking paper", "plastic wrap", "cling film",
            "glass bowl", "glass dish", "glass jar", "metal bowl", "metal skewer", "metal skewers",
            "wood skewer", "wooden skewer", "pizza stone", "seal the", "seal tightly", "seal well"
    ));
}
