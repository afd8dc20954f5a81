package io.insights.retail;

import java.util.List;

final class Fixtures {
    static final String SALES = "Date,Product,Category,Quantity,Amount,Customer_Age,Location\n"
            + "2024-08-01,Blue Kurta,Ethnic,1,100,30,Pune\n"
            + "2024-08-02,Red Saree,Ethnic,2,300,41,Delhi\n"
            + "2024-08-03,Blue Kurta,Ethnic,1,50,25,Mumbai\n";
    static final String INVENTORY = "Product,Category,Stock,Price,Supplier,Min_Alert\n"
            + "Blue Kurta,Ethnic,2,999,Style_Hub,5\n"
            + "Red Saree,Ethnic,10,1999,Fashion_Co,5\n";
    static final String REVIEWS = "Date,Rating,Review,Product,Platform\n"
            + "2024-09-01,5,Great quality,Blue Kurta,Google\n"
            + "2024-09-02,1,Terrible service,Red Saree,Amazon\n";

    private Fixtures() {}

    static List<RawDataset> all() {
        return List.of(
                RawDataset.of(DatasetKind.SALES, SALES),
                RawDataset.of(DatasetKind.INVENTORY, INVENTORY),
                RawDataset.of(DatasetKind.REVIEWS, REVIEWS));
    }
}
